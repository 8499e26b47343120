package com.featherplan.rules;

/**
 * How many times a {@link Batch} runs its rules.
 */
public sealed interface Strategy permits Strategy.Once, Strategy.FixedPoint {

    /**
     * Returns the maximum number of passes over the batch's rules.
     *
     * @return the pass cap, at least 1
     */
    int maxIterations();

    /** Runs every rule of the batch exactly once. */
    Strategy ONCE = new Once();

    /**
     * Runs every rule exactly once, in order.
     */
    record Once() implements Strategy {

        @Override
        public int maxIterations() {
            return 1;
        }

        @Override
        public String toString() {
            return "Once";
        }
    }

    /**
     * Repeats the rule sequence until a pass leaves the plan unchanged, or
     * until {@code maxIterations} passes have run.
     *
     * @param maxIterations the pass cap
     */
    record FixedPoint(int maxIterations) implements Strategy {

        public FixedPoint {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
            }
        }

        @Override
        public String toString() {
            return "FixedPoint(" + maxIterations + ")";
        }
    }

    static Strategy fixedPoint(int maxIterations) {
        return new FixedPoint(maxIterations);
    }
}
