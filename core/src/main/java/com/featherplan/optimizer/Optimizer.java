package com.featherplan.optimizer;

import com.featherplan.exception.QueryCompilationException;
import com.featherplan.expression.AttributeReference;
import com.featherplan.logical.LogicalPlan;
import com.featherplan.rules.Batch;
import com.featherplan.rules.RuleExecutor;
import com.featherplan.rules.Strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rule-based optimizer for analyzed logical plans.
 *
 * <p>The default pipeline has two batches:
 * <ol>
 *   <li>{@value #CONSTANT_FOLDING_BATCH}: ConstantFolding,
 *       BooleanSimplification, SimplifyFilters, SimplifyCasts</li>
 *   <li>{@value #FILTER_PUSHDOWN_BATCH}: CombineFilters,
 *       PushPredicateThroughProject, PushPredicateThroughInnerJoin</li>
 * </ol>
 * Order matters: folding turns constant subexpressions into literals before
 * boolean simplification looks for them, and filters are simplified before
 * they are pushed.
 *
 * <p>Example usage:
 * <pre>
 *   Optimizer optimizer = new Optimizer();
 *   LogicalPlan optimized = optimizer.optimize(analyzedPlan);
 * </pre>
 *
 * <p>An optimizer is immutable and may be shared between threads.
 */
public class Optimizer extends RuleExecutor<LogicalPlan> {

    private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

    public static final String CONSTANT_FOLDING_BATCH = "ConstantFolding";
    public static final String FILTER_PUSHDOWN_BATCH = "Filter Pushdown";

    private final List<Batch<LogicalPlan>> batches;
    private final Set<String> excludedRules;

    /**
     * Creates an optimizer with the default batches, each run once.
     */
    public Optimizer() {
        this(OptimizerConfig.defaults());
    }

    /**
     * Creates an optimizer with the default batches tuned by {@code config}.
     *
     * @param config the optimizer configuration
     */
    public Optimizer(OptimizerConfig config) {
        this(defaultBatches(config.iterateToFixedPoint()
                ? Strategy.fixedPoint(config.maxIterations())
                : Strategy.ONCE),
            config.excludedRules());
    }

    /**
     * Creates an optimizer running custom batches.
     *
     * @param batches the batches, in order
     */
    public Optimizer(List<Batch<LogicalPlan>> batches) {
        this(batches, Set.of());
    }

    private Optimizer(List<Batch<LogicalPlan>> batches, Set<String> excludedRules) {
        this.batches = List.copyOf(Objects.requireNonNull(batches, "batches must not be null"));
        this.excludedRules = Set.copyOf(excludedRules);
    }

    /**
     * Builds the default batches with the given strategy.
     *
     * @param strategy the strategy of both batches
     * @return the constant folding batch followed by the filter pushdown batch
     */
    public static List<Batch<LogicalPlan>> defaultBatches(Strategy strategy) {
        return List.of(
            Batch.of(CONSTANT_FOLDING_BATCH, strategy,
                new ConstantFolding(),
                new BooleanSimplification(),
                new SimplifyFilters(),
                new SimplifyCasts()),
            Batch.of(FILTER_PUSHDOWN_BATCH, strategy,
                new CombineFilters(),
                new PushPredicateThroughProject(),
                new PushPredicateThroughInnerJoin()));
    }

    @Override
    public List<Batch<LogicalPlan>> batches() {
        return batches;
    }

    @Override
    protected Set<String> excludedRules() {
        return excludedRules;
    }

    /**
     * Optimizes an analyzed plan.
     *
     * @param plan the analyzed plan
     * @return an equivalent plan with the same output
     * @throws QueryCompilationException if a constant expression fails to
     *         evaluate, or if the rewritten plan's output differs from the input's
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        logger.debug("Optimizing plan with {} nodes and output {}", plan.size(), plan.schema());

        LogicalPlan optimized = execute(plan);
        checkSameOutput(plan, optimized);

        if (logger.isDebugEnabled()) {
            logger.debug("Optimized plan ({} -> {} nodes):\n{}", plan.size(), optimized.size(), optimized.treeString());
        }
        return optimized;
    }

    private static void checkSameOutput(LogicalPlan original, LogicalPlan optimized) {
        List<AttributeReference> before = original.output();
        List<AttributeReference> after = optimized.output();
        boolean same = before.size() == after.size();
        for (int i = 0; same && i < before.size(); i++) {
            same = before.get(i).equals(after.get(i))
                && before.get(i).dataType().equals(after.get(i).dataType());
        }
        if (!same) {
            throw new QueryCompilationException(
                "Optimization changed the plan output from " + before + " to " + after, optimized);
        }
    }

    @Override
    protected String describe(LogicalPlan plan) {
        return plan.treeString();
    }
}
