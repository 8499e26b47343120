package com.featherplan.optimizer;

import com.featherplan.expression.And;
import com.featherplan.logical.Filter;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;

/**
 * Merges two adjacent filters into one whose condition is the conjunction of
 * both, inner condition first.
 *
 * <pre>
 *   Filter c2                  Filter (c1 AND c2)
 *   +- Filter c1      -&gt;      +- child
 *      +- child
 * </pre>
 */
public final class CombineFilters implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(node -> {
            if (node instanceof Filter outer && outer.child() instanceof Filter inner) {
                return new Filter(inner.child(), new And(inner.condition(), outer.condition()));
            }
            return node;
        });
    }
}
