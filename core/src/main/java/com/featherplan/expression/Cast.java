package com.featherplan.expression;

import com.featherplan.types.BooleanType;
import com.featherplan.types.DataType;
import com.featherplan.types.DoubleType;
import com.featherplan.types.IntegerType;
import com.featherplan.types.LongType;
import com.featherplan.types.StringType;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Expression that converts another expression to a different data type.
 *
 * <p>Examples:
 * <pre>
 *   CAST(amount AS double)
 *   CAST('42' AS integer)
 * </pre>
 *
 * <p>Analysis inserts casts liberally; a cast whose child already has the
 * target type is a no-op and is removed by the optimizer.
 */
public final class Cast implements Expression {

    private final Expression child;
    private final DataType targetType;

    /**
     * Creates a cast expression.
     *
     * @param child the expression to cast
     * @param targetType the target data type
     */
    public Cast(Expression child, DataType targetType) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression child() {
        return child;
    }

    public DataType targetType() {
        return targetType;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        // Cast preserves nullability
        return child.nullable();
    }

    @Override
    public Object eval(Row input) {
        Object value = child.eval(input);
        if (value == null) {
            return null;
        }
        try {
            return convert(value);
        } catch (NumberFormatException e) {
            throw new EvaluationException(
                "Cannot cast '" + value + "' to " + targetType.typeName(), e);
        }
    }

    private Object convert(Object value) {
        if (targetType instanceof StringType) {
            return String.valueOf(value);
        }
        if (targetType instanceof BooleanType) {
            return toBoolean(value);
        }
        if (targetType instanceof IntegerType) {
            return toNumber(value).intValue();
        }
        if (targetType instanceof LongType) {
            return toNumber(value).longValue();
        }
        if (targetType instanceof DoubleType) {
            return toNumber(value).doubleValue();
        }
        throw new EvaluationException(
            "Unsupported cast from " + child.dataType().typeName() + " to " + targetType.typeName());
    }

    private Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "t", "yes", "y", "1" -> true;
            case "false", "f", "no", "n", "0" -> false;
            default -> throw new EvaluationException("Cannot cast '" + value + "' to boolean");
        };
    }

    private Number toNumber(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        String s = value.toString().trim();
        if (targetType instanceof IntegerType) {
            return Integer.parseInt(s);
        }
        if (targetType.isIntegral()) {
            return Long.parseLong(s);
        }
        return Double.parseDouble(s);
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("Cast expects exactly one child");
        }
        return new Cast(newChildren.get(0), targetType);
    }

    @Override
    public String toString() {
        return "CAST(" + child + " AS " + targetType.typeName() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Cast)) return false;
        Cast that = (Cast) obj;
        return Objects.equals(child, that.child) &&
               Objects.equals(targetType, that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, targetType);
    }
}
