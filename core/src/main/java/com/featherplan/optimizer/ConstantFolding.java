package com.featherplan.optimizer;

import com.featherplan.exception.QueryCompilationException;
import com.featherplan.expression.EvaluationException;
import com.featherplan.expression.Expression;
import com.featherplan.expression.Literal;
import com.featherplan.expression.Row;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces expressions that can be evaluated at plan time with the equivalent
 * {@link Literal}.
 *
 * <pre>
 *   Filter (a#1 > (1 + 2))  ->  Filter (a#1 > 3)
 * </pre>
 *
 * <p>Expressions are visited top-down, so the largest foldable subtree is
 * replaced in one step. A failing evaluation is a compile error of the query.
 */
public final class ConstantFolding implements Rule<LogicalPlan> {

    private static final Logger logger = LoggerFactory.getLogger(ConstantFolding.class);

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transform(node ->
            node.transformExpressionsDown(expression -> fold(node, expression)));
    }

    private static Expression fold(LogicalPlan node, Expression expression) {
        // Skip redundant folding of literals
        if (expression instanceof Literal || !expression.foldable()) {
            return expression;
        }
        try {
            return new Literal(expression.eval(Row.EMPTY), expression.dataType());
        } catch (EvaluationException e) {
            logger.debug("Constant folding of {} in [{}] failed: {}", expression, node, e.getMessage());
            throw new QueryCompilationException(
                "Failed to evaluate constant expression " + expression, e, node);
        }
    }
}
