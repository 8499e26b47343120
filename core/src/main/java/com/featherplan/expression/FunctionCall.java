package com.featherplan.expression;

import com.featherplan.functions.FunctionRegistry;
import com.featherplan.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a scalar function call.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)
 *   abs(-5)
 *   coalesce(nickname, name)
 * </pre>
 *
 * <p>The result type is supplied by analysis. Determinism, and hence
 * foldability, comes from {@link FunctionRegistry}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;

    /**
     * Creates a function call.
     *
     * @param functionName the function name (case-insensitive)
     * @param arguments the argument expressions
     * @param dataType the resolved result type
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null")
            .toLowerCase(Locale.ROOT);
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public boolean deterministic() {
        return FunctionRegistry.isDeterministic(functionName) && Expression.super.deterministic();
    }

    @Override
    public Object eval(Row input) {
        FunctionRegistry.ScalarFunction function = FunctionRegistry.lookup(functionName)
            .orElseThrow(() -> new EvaluationException("Unknown function: " + functionName));
        List<Object> values = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            values.add(argument.eval(input));
        }
        return function.invoke(values);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != arguments.size()) {
            throw new IllegalArgumentException(
                functionName + " expects " + arguments.size() + " children but got " + newChildren.size());
        }
        return new FunctionCall(functionName, newChildren, dataType);
    }

    @Override
    public String toString() {
        return functionName + arguments.stream()
            .map(Object::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) &&
               arguments.equals(that.arguments) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType);
    }

    // ==================== Factory Methods ====================

    public static FunctionCall of(String functionName, DataType dataType, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments), dataType);
    }
}
