package com.featherplan.optimizer;

import com.featherplan.expression.And;
import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import com.featherplan.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers for working with conjunctive predicates.
 */
public final class PredicateHelper {

    private PredicateHelper() {}

    /**
     * Flattens nested {@link And}s into their conjuncts, depth-first and
     * left before right. A non-AND expression is a single conjunct.
     *
     * <pre>
     *   (a AND b) AND (c AND d)  ->  [a, b, c, d]
     * </pre>
     *
     * @param condition the predicate
     * @return the conjuncts, in order
     */
    public static List<Expression> splitConjunctivePredicates(Expression condition) {
        List<Expression> conjuncts = new ArrayList<>();
        collectConjuncts(condition, conjuncts);
        return conjuncts;
    }

    private static void collectConjuncts(Expression condition, List<Expression> out) {
        if (condition instanceof And and) {
            collectConjuncts(and.left(), out);
            collectConjuncts(and.right(), out);
        } else {
            out.add(condition);
        }
    }

    /**
     * Left-folds conjuncts back into one predicate:
     * {@code [a, b, c] -> ((a AND b) AND c)}.
     *
     * @param conjuncts the conjuncts, in order
     * @return the combined predicate, or empty for an empty list
     */
    public static Optional<Expression> reduceConjuncts(List<Expression> conjuncts) {
        Expression result = null;
        for (Expression conjunct : conjuncts) {
            result = result == null ? conjunct : new And(result, conjunct);
        }
        return Optional.ofNullable(result);
    }

    /**
     * Returns whether {@code expression} only reads columns produced by
     * {@code plan}.
     *
     * @param expression the expression
     * @param plan the plan whose output is available
     * @return true if every reference is in the plan's output set
     */
    public static boolean canEvaluate(Expression expression, LogicalPlan plan) {
        return canEvaluate(expression, plan.outputSet());
    }

    static boolean canEvaluate(Expression expression, Set<AttributeReference> available) {
        return available.containsAll(expression.references());
    }
}
