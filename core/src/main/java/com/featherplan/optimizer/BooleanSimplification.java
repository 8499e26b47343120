package com.featherplan.optimizer;

import com.featherplan.expression.And;
import com.featherplan.expression.Expression;
import com.featherplan.expression.Literal;
import com.featherplan.expression.Or;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;

/**
 * Simplifies AND/OR whose result is decided by a boolean literal operand.
 *
 * <p>Runs bottom-up so that operands have already been simplified. Dropping
 * the other operand is only valid because expression evaluation has no side
 * effects.
 */
public final class BooleanSimplification implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(node ->
            node.transformExpressionsUp(BooleanSimplification::simplify));
    }

    static Expression simplify(Expression expression) {
        if (expression instanceof And and) {
            Expression left = and.left();
            Expression right = and.right();
            if (Literal.TRUE.equals(left)) return right;
            if (Literal.TRUE.equals(right)) return left;
            if (Literal.FALSE.equals(left) || Literal.FALSE.equals(right)) return Literal.FALSE;
            return and;
        }
        if (expression instanceof Or or) {
            Expression left = or.left();
            Expression right = or.right();
            if (Literal.TRUE.equals(left) || Literal.TRUE.equals(right)) return Literal.TRUE;
            if (Literal.FALSE.equals(left)) return right;
            if (Literal.FALSE.equals(right)) return left;
            return or;
        }
        return expression;
    }
}
