package com.featherplan.expression;

import com.featherplan.types.DataType;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A resolved reference to a column produced somewhere in the plan.
 *
 * <p>Equality is identity based: two references are equal iff they carry the
 * same {@link ExprId}. Name, qualifier and type are kept for display and type
 * checks only; plans routinely contain several columns with the same name
 * (both sides of a self-join, for instance).
 *
 * <p>Printed as {@code name#id}, or {@code qualifier.name#id} when qualified.
 */
public final class AttributeReference implements NamedExpression {

    private final String name;
    private final DataType dataType;
    private final boolean nullable;
    private final ExprId exprId;
    private final String qualifier; // Optional relation alias, display only

    /**
     * Creates an attribute reference.
     *
     * @param name the column name
     * @param dataType the column type
     * @param nullable whether the column can hold NULL
     * @param exprId the identity of the column
     * @param qualifier the relation qualifier (may be null)
     */
    public AttributeReference(String name, DataType dataType, boolean nullable, ExprId exprId, String qualifier) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
        this.qualifier = qualifier;
    }

    /**
     * Creates an attribute reference with a fresh identity.
     *
     * @param name the column name
     * @param dataType the column type
     * @param nullable whether the column can hold NULL
     */
    public AttributeReference(String name, DataType dataType, boolean nullable) {
        this(name, dataType, nullable, ExprId.newExprId(), null);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExprId exprId() {
        return exprId;
    }

    /**
     * Returns the qualifier (relation alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public AttributeReference toAttribute() {
        return this;
    }

    /**
     * Returns the same column seen under another qualifier.
     *
     * @param newQualifier the qualifier (may be null)
     * @return a reference with the same identity
     */
    public AttributeReference withQualifier(String newQualifier) {
        if (Objects.equals(qualifier, newQualifier)) {
            return this;
        }
        return new AttributeReference(name, dataType, nullable, exprId, newQualifier);
    }

    /**
     * Returns the same column with different nullability, as seen from the
     * null-supplying side of an outer join.
     *
     * @param newNullable the nullability
     * @return a reference with the same identity
     */
    public AttributeReference withNullability(boolean newNullable) {
        if (nullable == newNullable) {
            return this;
        }
        return new AttributeReference(name, dataType, newNullable, exprId, qualifier);
    }

    /**
     * Returns a brand new column with the same name and type.
     *
     * @return a reference with a fresh identity
     */
    public AttributeReference newInstance() {
        return new AttributeReference(name, dataType, nullable, ExprId.newExprId(), qualifier);
    }

    @Override
    public Set<AttributeReference> references() {
        return Set.of(this);
    }

    @Override
    public Object eval(Row input) {
        throw new EvaluationException("Cannot evaluate unbound attribute " + this);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("AttributeReference has no children");
        }
        return this;
    }

    @Override
    public String toString() {
        String base = name + "#" + exprId;
        return qualifier != null ? qualifier + "." + base : base;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeReference)) return false;
        return exprId.equals(((AttributeReference) obj).exprId);
    }

    @Override
    public int hashCode() {
        return exprId.hashCode();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a nullable column reference with a fresh identity.
     *
     * @param name the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static AttributeReference of(String name, DataType dataType) {
        return new AttributeReference(name, dataType, true);
    }

    /**
     * Creates a qualified, nullable column reference with a fresh identity.
     *
     * @param qualifier the relation alias
     * @param name the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static AttributeReference qualified(String qualifier, String name, DataType dataType) {
        return new AttributeReference(name, dataType, true, ExprId.newExprId(), qualifier);
    }
}
