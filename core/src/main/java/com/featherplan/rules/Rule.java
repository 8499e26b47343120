package com.featherplan.rules;

/**
 * A single named rewrite over trees of type {@code T}.
 *
 * <p>A rule transforms a plan into an equivalent plan that should be cheaper
 * to execute. It returns its input unchanged, ideally the very same instance,
 * when it does not apply.
 *
 * <p>Rules must preserve query semantics and the output schema, and should be
 * idempotent: applying a rule to its own output must not change it further.
 * The executor does not check either property.
 *
 * @param <T> the tree type the rule rewrites
 */
public interface Rule<T> {

    /**
     * Applies this rule.
     *
     * @param plan the input plan
     * @return the rewritten plan, or the input if the rule does not apply
     */
    T apply(T plan);

    /**
     * Returns the name of this rule, used for logging and exclusion.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
