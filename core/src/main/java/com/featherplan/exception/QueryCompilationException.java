package com.featherplan.exception;

import com.featherplan.expression.EvaluationException;
import com.featherplan.logical.LogicalPlan;

/**
 * Exception thrown when a query cannot be compiled into an optimized plan.
 *
 * <p>The optimizer raises it when folding a constant expression fails (the
 * error would otherwise surface at execution time) and when a rewrite breaks
 * the output schema of the plan. It carries the plan node being processed for
 * diagnostics.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       LogicalPlan optimized = optimizer.optimize(plan);
 *   } catch (QueryCompilationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed plan: " + e.getFailedPlan());
 *   }
 * </pre>
 */
public class QueryCompilationException extends RuntimeException {

    private final LogicalPlan failedPlan;

    /**
     * Creates a query compilation exception.
     *
     * @param message the error message
     * @param plan the plan node being compiled
     */
    public QueryCompilationException(String message, LogicalPlan plan) {
        super(message + " (plan node: " + nodeType(plan) + ")");
        this.failedPlan = plan;
    }

    /**
     * Creates a query compilation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the plan node being compiled
     */
    public QueryCompilationException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan node: " + nodeType(plan) + ")", cause);
        this.failedPlan = plan;
    }

    private static String nodeType(LogicalPlan plan) {
        return plan != null ? plan.getClass().getSimpleName() : "null";
    }

    /**
     * Returns the plan node that failed to compile.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan getFailedPlan() {
        return failedPlan;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (getCause() instanceof EvaluationException) {
            return "The query contains a constant expression that cannot be evaluated: "
                + getCause().getMessage();
        }
        return "The query could not be compiled: " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Compilation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedPlan != null) {
            sb.append("Failed Plan Type: ").append(failedPlan.getClass().getName()).append("\n");
            sb.append("Plan:\n").append(failedPlan.treeString());
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
