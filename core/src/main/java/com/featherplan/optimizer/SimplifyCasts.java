package com.featherplan.optimizer;

import com.featherplan.expression.Cast;
import com.featherplan.expression.Expression;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;

/**
 * Removes casts whose input already has the target type, anywhere in the plan.
 *
 * <p>A stack of such casts is removed in one step, so
 * {@code CAST(CAST(a AS integer) AS integer)} becomes {@code a} for an integer
 * column {@code a}.
 */
public final class SimplifyCasts implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformAllExpressions(SimplifyCasts::stripRedundantCasts);
    }

    private static Expression stripRedundantCasts(Expression expression) {
        Expression result = expression;
        while (result instanceof Cast cast && cast.child().dataType().equals(cast.targetType())) {
            result = cast.child();
        }
        return result;
    }
}
