package com.featherplan.expression;

import com.featherplan.types.BooleanType;
import com.featherplan.types.DataType;
import com.featherplan.types.DoubleType;
import com.featherplan.types.IntegerType;
import com.featherplan.types.LongType;
import com.featherplan.types.NullType;
import com.featherplan.types.StringType;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>Literals are the only leaves that are foldable. Constant folding produces
 * them and never rewraps them, so rules may rely on a literal surviving a
 * folding pass as the very same instance.
 *
 * <p>Examples:
 * <pre>
 *   42              -- integer literal
 *   'hello'         -- string literal
 *   TRUE            -- boolean literal
 *   NULL            -- null literal of some type
 * </pre>
 */
public final class Literal implements Expression {

    public static final Literal TRUE = new Literal(true, BooleanType.get());

    public static final Literal FALSE = new Literal(false, BooleanType.get());

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public boolean foldable() {
        return true;
    }

    @Override
    public Object eval(Row input) {
        return value;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("Literal has no children");
        }
        return this;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (dataType instanceof StringType) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase();
        }
        if (dataType instanceof LongType) {
            return value + "L";
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }

    /**
     * Creates an untyped NULL literal.
     *
     * @return a NULL literal of {@link NullType}
     */
    public static Literal nullValue() {
        return new Literal(null, NullType.get());
    }
}
