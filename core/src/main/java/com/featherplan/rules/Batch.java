package com.featherplan.rules;

import java.util.List;
import java.util.Objects;

/**
 * An ordered group of rules sharing one convergence strategy.
 *
 * @param name the batch name, used in logs
 * @param strategy how often the rules run
 * @param rules the rules, applied in this order
 * @param <T> the tree type the rules rewrite
 */
public record Batch<T>(String name, Strategy strategy, List<Rule<T>> rules) {

    public Batch {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * Creates a batch from a rule array.
     *
     * @param name the batch name
     * @param strategy the convergence strategy
     * @param rules the rules in application order
     * @param <T> the tree type
     * @return the batch
     */
    @SafeVarargs
    public static <T> Batch<T> of(String name, Strategy strategy, Rule<T>... rules) {
        return new Batch<>(name, strategy, List.of(rules));
    }

    @Override
    public String toString() {
        return String.format("Batch(%s, %s, %d rules)", name, strategy, rules.size());
    }
}
