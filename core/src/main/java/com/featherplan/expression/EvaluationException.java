package com.featherplan.expression;

/**
 * Thrown when an expression cannot produce a value: division by zero, a
 * failed cast, incomparable operands, an unknown function or an attribute
 * that is not bound to an input column.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
