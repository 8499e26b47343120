package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a LIMIT clause.
 *
 * <p>The row count is an expression so that analysis can hand over
 * {@code LIMIT 10 * 2}; it must be foldable by the time the plan is executed.
 */
public final class Limit extends LogicalPlan {

    private final Expression limitExpression;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param limitExpression the maximum number of rows
     */
    public Limit(LogicalPlan child, Expression limitExpression) {
        super(child);
        this.limitExpression = Objects.requireNonNull(limitExpression, "limitExpression must not be null");
    }

    public Expression limitExpression() {
        return limitExpression;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(limitExpression);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        Expression newLimit = fn.apply(limitExpression);
        return newLimit == limitExpression ? this : new Limit(child(), newLimit);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("Limit expects exactly one child");
        }
        return new Limit(newChildren.get(0), limitExpression);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Limit)) return false;
        Limit that = (Limit) obj;
        return limitExpression.equals(that.limitExpression) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(limitExpression, child());
    }

    @Override
    public String toString() {
        return String.format("Limit %s", limitExpression);
    }
}
