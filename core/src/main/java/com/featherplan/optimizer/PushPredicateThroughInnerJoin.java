package com.featherplan.optimizer;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import com.featherplan.logical.Filter;
import com.featherplan.logical.Join;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pushes the conjuncts of a filter above an inner join to the join side that
 * can evaluate them, and moves the rest into the join condition.
 *
 * <p>The filter condition and the existing join condition are split into
 * conjuncts and partitioned, keeping their relative order:
 * <ul>
 *   <li>conjuncts that only read right-side columns filter the right input,</li>
 *   <li>otherwise, conjuncts that only read left-side columns filter the left
 *       input,</li>
 *   <li>everything else becomes the join condition.</li>
 * </ul>
 * A side with nothing to push is left untouched; a join left with nothing to
 * evaluate gets no condition. A filter pushed onto a side that is itself an
 * inner join is pushed again, so a chain of joins is handled in one
 * application.
 */
public final class PushPredicateThroughInnerJoin implements Rule<LogicalPlan> {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(PushPredicateThroughInnerJoin::push);
    }

    private static LogicalPlan push(LogicalPlan node) {
        if (node instanceof Filter filter
                && filter.child() instanceof Join join
                && join.joinType() == Join.JoinType.INNER) {
            return pushDown(filter.condition(), join);
        }
        return node;
    }

    private static LogicalPlan pushDown(Expression filterCondition, Join join) {
        List<Expression> allConditions = new ArrayList<>(
            PredicateHelper.splitConjunctivePredicates(filterCondition));
        join.condition().ifPresent(c -> allConditions.addAll(PredicateHelper.splitConjunctivePredicates(c)));

        LogicalPlan left = join.left();
        LogicalPlan right = join.right();
        Set<AttributeReference> leftOutput = left.outputSet();
        Set<AttributeReference> rightOutput = right.outputSet();

        // Split the predicates into those that can be evaluated on the left, right, and those that
        // must be evaluated after the join.
        List<Expression> rightConditions = new ArrayList<>();
        List<Expression> leftConditions = new ArrayList<>();
        List<Expression> joinConditions = new ArrayList<>();
        for (Expression condition : allConditions) {
            if (PredicateHelper.canEvaluate(condition, rightOutput)) {
                rightConditions.add(condition);
            } else if (PredicateHelper.canEvaluate(condition, leftOutput)) {
                leftConditions.add(condition);
            } else {
                joinConditions.add(condition);
            }
        }

        LogicalPlan newLeft = withFilter(left, leftConditions);
        LogicalPlan newRight = withFilter(right, rightConditions);
        Expression newJoinCondition = PredicateHelper.reduceConjuncts(joinConditions).orElse(null);
        return new Join(newLeft, newRight, Join.JoinType.INNER, newJoinCondition);
    }

    private static LogicalPlan withFilter(LogicalPlan child, List<Expression> conditions) {
        Optional<Expression> condition = PredicateHelper.reduceConjuncts(conditions);
        return condition.isPresent() ? push(new Filter(child, condition.get())) : child;
    }
}
