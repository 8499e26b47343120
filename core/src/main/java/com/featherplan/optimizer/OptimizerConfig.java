package com.featherplan.optimizer;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Tunables of the {@link Optimizer}.
 *
 * <ul>
 *   <li>{@code featherplan.optimizer.excludedRules}: comma-separated rule names
 *       to skip (default none)</li>
 *   <li>{@code featherplan.optimizer.iterateToFixedPoint}: run the default
 *       batches to a fixed point instead of once (default {@code false})</li>
 *   <li>{@code featherplan.optimizer.maxIterations}: pass cap of fixed-point
 *       batches (default {@value #DEFAULT_MAX_ITERATIONS})</li>
 * </ul>
 *
 * <p>Instances are immutable; use {@link #builder()} or
 * {@link #fromProperties(Properties)}.
 */
public final class OptimizerConfig {

    public static final String EXCLUDED_RULES_KEY = "featherplan.optimizer.excludedRules";
    public static final String ITERATE_TO_FIXED_POINT_KEY = "featherplan.optimizer.iterateToFixedPoint";
    public static final String MAX_ITERATIONS_KEY = "featherplan.optimizer.maxIterations";

    /** Default pass cap for fixed-point batches */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final OptimizerConfig DEFAULTS = builder().build();

    private final Set<String> excludedRules;
    private final boolean iterateToFixedPoint;
    private final int maxIterations;

    private OptimizerConfig(Builder builder) {
        this.excludedRules = Set.copyOf(builder.excludedRules);
        this.iterateToFixedPoint = builder.iterateToFixedPoint;
        this.maxIterations = builder.maxIterations;
    }

    /**
     * Returns the configuration with every tunable at its default: both
     * batches run once and no rule is excluded.
     *
     * @return the default configuration
     */
    public static OptimizerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from properties. Missing keys keep their
     * defaults.
     *
     * @param properties the source, e.g. {@code System.getProperties()}
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static OptimizerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();

        String excluded = properties.getProperty(EXCLUDED_RULES_KEY);
        if (excluded != null) {
            Arrays.stream(excluded.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(builder::excludeRule);
        }

        String iterate = properties.getProperty(ITERATE_TO_FIXED_POINT_KEY);
        if (iterate != null) {
            builder.iterateToFixedPoint(parseBoolean(ITERATE_TO_FIXED_POINT_KEY, iterate));
        }

        String max = properties.getProperty(MAX_ITERATIONS_KEY);
        if (max != null) {
            builder.maxIterations(parseInt(MAX_ITERATIONS_KEY, max));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Valid values: true, false".formatted(key, value));
        };
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid value for %s: '%s'. Expected an integer".formatted(key, value), e);
        }
    }

    public Set<String> excludedRules() {
        return excludedRules;
    }

    public boolean iterateToFixedPoint() {
        return iterateToFixedPoint;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimizerConfig)) return false;
        OptimizerConfig that = (OptimizerConfig) o;
        return iterateToFixedPoint == that.iterateToFixedPoint &&
               maxIterations == that.maxIterations &&
               excludedRules.equals(that.excludedRules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(excludedRules, iterateToFixedPoint, maxIterations);
    }

    @Override
    public String toString() {
        return String.format("OptimizerConfig(excludedRules=%s, iterateToFixedPoint=%s, maxIterations=%d)",
            excludedRules, iterateToFixedPoint, maxIterations);
    }

    /**
     * Builder for {@link OptimizerConfig}.
     */
    public static final class Builder {

        private final Set<String> excludedRules = new LinkedHashSet<>();
        private boolean iterateToFixedPoint = false;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;

        private Builder() {}

        public Builder excludeRule(String ruleName) {
            excludedRules.add(Objects.requireNonNull(ruleName, "ruleName must not be null"));
            return this;
        }

        public Builder iterateToFixedPoint(boolean iterate) {
            this.iterateToFixedPoint = iterate;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public OptimizerConfig build() {
            return new OptimizerConfig(this);
        }
    }
}
