package com.featherplan.functions;

import com.featherplan.expression.EvaluationException;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Registry of the scalar built-in functions the optimizer knows how to
 * evaluate at plan time.
 *
 * <p>Each entry records whether the function is deterministic; constant
 * folding only touches calls to deterministic functions with foldable
 * arguments. Calls to functions missing from the registry are treated as
 * non-deterministic and are left for the execution engine.
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: upper, lower, length</li>
 *   <li>Math functions: abs, rand</li>
 *   <li>Conditional functions: coalesce</li>
 * </ul>
 */
public final class FunctionRegistry {

    /**
     * A built-in scalar function.
     *
     * @param name the lower-case function name
     * @param deterministic whether repeated calls with equal arguments agree
     * @param minArgs minimum argument count
     * @param maxArgs maximum argument count, or -1 for variadic
     * @param body the implementation over already evaluated arguments
     */
    public record ScalarFunction(String name, boolean deterministic, int minArgs, int maxArgs,
                                 Function<List<Object>, Object> body) {

        /**
         * Invokes the function after checking its arity.
         *
         * @param args evaluated arguments, nulls allowed
         * @return the result
         * @throws EvaluationException on arity or argument type errors
         */
        public Object invoke(List<Object> args) {
            if (args.size() < minArgs || (maxArgs >= 0 && args.size() > maxArgs)) {
                throw new EvaluationException(String.format(
                    "Function %s expects %s arguments but got %d", name, arity(), args.size()));
            }
            return body.apply(args);
        }

        private String arity() {
            if (maxArgs < 0) {
                return "at least " + minArgs;
            }
            return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
        }
    }

    private static final Map<String, ScalarFunction> FUNCTIONS = new HashMap<>();

    static {
        initializeStringFunctions();
        initializeMathFunctions();
        initializeConditionalFunctions();
    }

    private FunctionRegistry() {}

    private static void initializeStringFunctions() {
        register(new ScalarFunction("upper", true, 1, 1,
            args -> nullSafe(args.get(0), v -> asString("upper", v).toUpperCase(Locale.ROOT))));
        register(new ScalarFunction("lower", true, 1, 1,
            args -> nullSafe(args.get(0), v -> asString("lower", v).toLowerCase(Locale.ROOT))));
        register(new ScalarFunction("length", true, 1, 1,
            args -> nullSafe(args.get(0), v -> asString("length", v).length())));
    }

    private static void initializeMathFunctions() {
        register(new ScalarFunction("abs", true, 1, 1,
            args -> nullSafe(args.get(0), FunctionRegistry::abs)));
        register(new ScalarFunction("rand", false, 0, 0,
            args -> ThreadLocalRandom.current().nextDouble()));
    }

    private static void initializeConditionalFunctions() {
        register(new ScalarFunction("coalesce", true, 1, -1, args -> {
            for (Object arg : args) {
                if (arg != null) {
                    return arg;
                }
            }
            return null;
        }));
    }

    private static void register(ScalarFunction function) {
        FUNCTIONS.put(function.name(), function);
    }

    /**
     * Looks up a function by name, case-insensitively.
     *
     * @param functionName the function name
     * @return the function, or empty if not registered
     */
    public static Optional<ScalarFunction> lookup(String functionName) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(functionName.toLowerCase(Locale.ROOT)));
    }

    public static boolean isSupported(String functionName) {
        return lookup(functionName).isPresent();
    }

    /**
     * Returns whether calls to the function may be folded at plan time.
     *
     * @param functionName the function name
     * @return false for non-deterministic and unknown functions
     */
    public static boolean isDeterministic(String functionName) {
        return lookup(functionName).map(ScalarFunction::deterministic).orElse(false);
    }

    private static Object nullSafe(Object value, Function<Object, Object> fn) {
        return value == null ? null : fn.apply(value);
    }

    private static String asString(String function, Object value) {
        if (!(value instanceof String)) {
            throw new EvaluationException(function + " expects a string argument but got " + value);
        }
        return (String) value;
    }

    private static Object abs(Object value) {
        if (value instanceof Integer i) {
            return Math.abs(i);
        }
        if (value instanceof Long l) {
            return Math.abs(l);
        }
        if (value instanceof Double d) {
            return Math.abs(d);
        }
        throw new EvaluationException("abs expects a numeric argument but got " + value);
    }
}
