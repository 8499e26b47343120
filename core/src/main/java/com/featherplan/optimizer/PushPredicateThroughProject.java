package com.featherplan.optimizer;

import com.featherplan.expression.Alias;
import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import com.featherplan.expression.NamedExpression;
import com.featherplan.logical.Filter;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.logical.Project;
import com.featherplan.rules.Rule;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes a filter below the projection it sits on, in-lining the aliases the
 * projection defines.
 *
 * <pre>
 *   Filter (y#5 > 5)                       Project [(x#1 + 1) AS y#5]
 *   +- Project [(x#1 + 1) AS y#5]    -&gt;    +- Filter ((x#1 + 1) > 5)
 *      +- TableScan t [x#1]                   +- TableScan t [x#1]
 * </pre>
 *
 * <p>The pushed filter keeps sinking through directly nested projections.
 * Assumes the in-lined expressions are cheap to evaluate twice.
 */
public final class PushPredicateThroughProject implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(PushPredicateThroughProject::push);
    }

    private static LogicalPlan push(LogicalPlan node) {
        if (node instanceof Filter filter && filter.child() instanceof Project project) {
            Map<AttributeReference, Expression> sourceAliases = new HashMap<>();
            for (NamedExpression projection : project.projections()) {
                if (projection instanceof Alias alias) {
                    sourceAliases.put(alias.toAttribute(), alias.child());
                }
            }
            Filter pushed = new Filter(project.child(), replaceAlias(filter.condition(), sourceAliases));
            return project.withNewChildren(List.of(push(pushed)));
        }
        return node;
    }

    /**
     * Substitutes every reference to an alias attribute with the aliased
     * expression. Substituted expressions are not visited again.
     *
     * @param condition the predicate
     * @param sourceAliases alias attribute to defining expression
     * @return the rewritten predicate
     */
    static Expression replaceAlias(Expression condition, Map<AttributeReference, Expression> sourceAliases) {
        if (sourceAliases.isEmpty()) {
            return condition;
        }
        return condition.transformUp(expression -> {
            if (expression instanceof AttributeReference attribute) {
                return sourceAliases.getOrDefault(attribute, attribute);
            }
            return expression;
        });
    }
}
