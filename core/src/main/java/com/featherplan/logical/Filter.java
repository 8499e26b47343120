package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>This node keeps the rows of its child for which the condition evaluates
 * to TRUE. The output is exactly the child's output.
 *
 * <p>Examples:
 * <pre>
 *   SELECT * FROM t WHERE age > 25
 *   df.where(col("price") > 100 && col("category") == "electronics")
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        // Filter doesn't change the schema
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        Expression newCondition = fn.apply(condition);
        return newCondition == condition ? this : new Filter(child(), newCondition);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("Filter expects exactly one child");
        }
        return new Filter(newChildren.get(0), condition);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Filter)) return false;
        Filter that = (Filter) obj;
        return condition.equals(that.condition) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, child());
    }

    @Override
    public String toString() {
        return String.format("Filter %s", condition);
    }
}
