package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a join operation.
 *
 * <p>The output is the left output followed by the right output, except for
 * {@link JoinType#LEFT_SEMI} which only returns left rows. Columns on the
 * null-supplying side of an outer join are reported as nullable; their
 * identities do not change.
 *
 * <p>The condition is optional for every join type: an inner join without a
 * condition is a cartesian product.
 *
 * <p>Supported join types:
 * <ul>
 *   <li>INNER - Standard inner join</li>
 *   <li>LEFT_OUTER - Left outer join</li>
 *   <li>RIGHT_OUTER - Right outer join</li>
 *   <li>FULL_OUTER - Full outer join</li>
 *   <li>LEFT_SEMI - Left semi join (returns left rows with matches)</li>
 * </ul>
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param condition the join condition (may be null)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;
    }

    /**
     * Creates a join node without a condition.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType) {
        this(left, right, joinType, null);
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, or empty when the join has none
     */
    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> leftOutput = left().output();
        List<AttributeReference> rightOutput = right().output();
        switch (joinType) {
            case LEFT_SEMI:
                return leftOutput;
            case LEFT_OUTER:
                return concat(leftOutput, asNullable(rightOutput));
            case RIGHT_OUTER:
                return concat(asNullable(leftOutput), rightOutput);
            case FULL_OUTER:
                return concat(asNullable(leftOutput), asNullable(rightOutput));
            case INNER:
            default:
                return concat(leftOutput, rightOutput);
        }
    }

    private static List<AttributeReference> asNullable(List<AttributeReference> attributes) {
        List<AttributeReference> result = new ArrayList<>(attributes.size());
        for (AttributeReference attribute : attributes) {
            result.add(attribute.withNullability(true));
        }
        return result;
    }

    private static List<AttributeReference> concat(List<AttributeReference> a, List<AttributeReference> b) {
        List<AttributeReference> result = new ArrayList<>(a.size() + b.size());
        result.addAll(a);
        result.addAll(b);
        return result;
    }

    @Override
    public List<Expression> expressions() {
        return condition == null ? List.of() : List.of(condition);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        if (condition == null) {
            return this;
        }
        Expression newCondition = fn.apply(condition);
        return newCondition == condition ? this : new Join(left(), right(), joinType, newCondition);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (newChildren.size() != 2) {
            throw new IllegalArgumentException("Join expects exactly two children");
        }
        return new Join(newChildren.get(0), newChildren.get(1), joinType, condition);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Join)) return false;
        Join that = (Join) obj;
        return joinType == that.joinType &&
               Objects.equals(condition, that.condition) &&
               left().equals(that.left()) &&
               right().equals(that.right());
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, condition, left(), right());
    }

    @Override
    public String toString() {
        if (condition != null) {
            return String.format("Join %s, %s", joinType, condition);
        }
        return String.format("Join %s", joinType);
    }

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER,
        LEFT_OUTER,
        RIGHT_OUTER,
        FULL_OUTER,
        LEFT_SEMI
    }
}
