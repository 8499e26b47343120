package com.featherplan.expression;

import com.featherplan.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Expression that gives a name, and a new column identity, to another
 * expression.
 *
 * <p>Examples:
 * <pre>
 *   price * quantity AS total
 *   upper(name) AS name_uc
 * </pre>
 *
 * <p>An alias is never foldable even if its child is: replacing it by a
 * literal would drop the column it defines. Constant folding descends into the
 * child instead.
 */
public final class Alias implements NamedExpression {

    private final Expression child;
    private final String name;
    private final ExprId exprId;

    /**
     * Creates an alias with an explicit identity.
     *
     * @param child the aliased expression
     * @param name the alias name
     * @param exprId the identity of the defined column
     */
    public Alias(Expression child, String name, ExprId exprId) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
    }

    /**
     * Creates an alias defining a brand new column.
     *
     * @param child the aliased expression
     * @param name the alias name
     */
    public Alias(Expression child, String name) {
        this(child, name, ExprId.newExprId());
    }

    public Expression child() {
        return child;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExprId exprId() {
        return exprId;
    }

    @Override
    public AttributeReference toAttribute() {
        return new AttributeReference(name, child.dataType(), child.nullable(), exprId, null);
    }

    @Override
    public DataType dataType() {
        return child.dataType();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public boolean foldable() {
        return false;
    }

    @Override
    public Object eval(Row input) {
        return child.eval(input);
    }

    @Override
    public List<Expression> children() {
        return List.of(child);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("Alias expects exactly one child");
        }
        return new Alias(newChildren.get(0), name, exprId);
    }

    @Override
    public String toString() {
        return child + " AS " + name + "#" + exprId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return Objects.equals(exprId, that.exprId) &&
               Objects.equals(name, that.name) &&
               Objects.equals(child, that.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, name, exprId);
    }
}
