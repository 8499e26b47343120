package com.featherplan.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs an ordered list of {@link Batch}es of rules over a tree.
 *
 * <p>Batches run in declaration order, each seeing the previous batch's
 * result. Within a batch, rules run one after another in declared order; the
 * whole sequence is repeated according to the batch's {@link Strategy}:
 * <ul>
 *   <li>{@code Once}: a single pass.</li>
 *   <li>{@code FixedPoint(n)}: passes repeat until one leaves the plan equal
 *       to what it started with, or until {@code n} passes have run. Hitting
 *       the cap is not an error: the last plan is kept and a warning is
 *       logged.</li>
 * </ul>
 *
 * <p>An executor is configuration only. {@link #execute(Object)} keeps no
 * state between calls, so one instance can serve concurrent optimizations.
 *
 * <p>Example usage:
 * <pre>
 *   RuleExecutor&lt;LogicalPlan&gt; optimizer = new Optimizer();
 *   LogicalPlan optimized = optimizer.execute(plan);
 * </pre>
 *
 * @param <T> the tree type the rules rewrite
 */
public abstract class RuleExecutor<T> {

    private static final Logger logger = LoggerFactory.getLogger(RuleExecutor.class);

    /**
     * Returns the batches to run, in order.
     *
     * @return the batches
     */
    public abstract List<Batch<T>> batches();

    /**
     * Returns the names of rules to skip wherever they appear.
     *
     * @return rule names, empty by default
     */
    protected Set<String> excludedRules() {
        return Set.of();
    }

    /**
     * Runs all batches over {@code plan}.
     *
     * @param plan the input plan
     * @return the rewritten plan
     */
    public T execute(T plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        T current = plan;
        for (Batch<T> batch : batches()) {
            current = executeBatch(batch, current);
        }
        return current;
    }

    private T executeBatch(Batch<T> batch, T plan) {
        List<Rule<T>> rules = effectiveRules(batch);
        if (rules.isEmpty()) {
            logger.debug("Skipping batch '{}': no rules left to run", batch.name());
            return plan;
        }

        Strategy strategy = batch.strategy();
        T current = plan;
        int iteration = 0;
        boolean converged = false;

        while (iteration < strategy.maxIterations()) {
            iteration++;
            T passStart = current;

            // Apply each rule in sequence
            for (Rule<T> rule : rules) {
                current = applyRule(batch, rule, current);
            }

            if (sameTree(current, passStart)) {
                converged = true;
                break;
            }
        }

        if (!converged && strategy instanceof Strategy.FixedPoint) {
            onNonConvergence(batch, iteration, current);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Batch '{}' ({}) finished after {} pass(es), plan {}",
                batch.name(), strategy, iteration, sameTree(current, plan) ? "unchanged" : "changed");
        }
        return current;
    }

    private T applyRule(Batch<T> batch, Rule<T> rule, T plan) {
        T result = rule.apply(plan);
        if (result == null) {
            throw new IllegalStateException(
                "Rule " + rule.name() + " in batch '" + batch.name() + "' returned null");
        }
        if (!sameTree(result, plan)) {
            logger.debug("Rule {} changed the plan in batch '{}'", rule.name(), batch.name());
            if (logger.isTraceEnabled()) {
                logger.trace("=== Applying rule {} ===\nBefore:\n{}\nAfter:\n{}",
                    rule.name(), describe(plan), describe(result));
            }
        }
        return result;
    }

    private List<Rule<T>> effectiveRules(Batch<T> batch) {
        Set<String> excluded = excludedRules();
        if (excluded.isEmpty()) {
            return batch.rules();
        }
        List<Rule<T>> rules = new ArrayList<>(batch.rules().size());
        for (Rule<T> rule : batch.rules()) {
            if (excluded.contains(rule.name())) {
                logger.debug("Rule {} is excluded from batch '{}'", rule.name(), batch.name());
            } else {
                rules.add(rule);
            }
        }
        return rules;
    }

    private boolean sameTree(T a, T b) {
        return a == b || a.equals(b);
    }

    /**
     * Called when a fixed-point batch used up its passes while the plan was
     * still changing. The default logs a warning; the plan is kept either way.
     *
     * @param batch the batch that did not converge
     * @param iterations the number of passes run
     * @param lastPlan the plan produced by the last pass
     */
    protected void onNonConvergence(Batch<T> batch, int iterations, T lastPlan) {
        logger.warn("Batch '{}' did not reach a fixed point after {} iterations; "
            + "continuing with the last plan", batch.name(), iterations);
    }

    /**
     * Renders a plan for trace logging.
     *
     * @param plan the plan
     * @return a printable form, {@code toString()} by default
     */
    protected String describe(T plan) {
        return String.valueOf(plan);
    }
}
