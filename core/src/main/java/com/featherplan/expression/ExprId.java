package com.featherplan.expression;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identity token of a column-producing site.
 *
 * <p>Two attributes denote the same column iff their ids are equal, regardless
 * of their names: after a self-join both sides expose a column called
 * {@code id}, and they must not be conflated.
 *
 * @param id the numeric token, unique within this process
 */
public record ExprId(long id) {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    /**
     * Issues a fresh id. Safe to call from concurrent optimizations.
     *
     * @return a new, never before issued id
     */
    public static ExprId newExprId() {
        return new ExprId(NEXT_ID.getAndIncrement());
    }

    @Override
    public String toString() {
        return Long.toString(id);
    }
}
