package com.featherplan.optimizer;

import com.featherplan.expression.Literal;
import com.featherplan.logical.Filter;
import com.featherplan.logical.LocalRelation;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;

/**
 * Removes filters whose condition is a literal.
 *
 * <p>A filter that is always TRUE is replaced by its child. A filter that is
 * always FALSE or NULL can never admit a row and becomes an empty
 * {@link LocalRelation} with the child's output, so operators above still
 * resolve.
 */
public final class SimplifyFilters implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(node -> {
            if (node instanceof Filter filter && filter.condition() instanceof Literal literal) {
                if (Literal.TRUE.equals(literal)) {
                    return filter.child();
                }
                if (literal.isNull() || Literal.FALSE.equals(literal)) {
                    return new LocalRelation(filter.child().output());
                }
            }
            return node;
        });
    }
}
