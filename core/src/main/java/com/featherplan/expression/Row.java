package com.featherplan.expression;

import java.util.Arrays;

/**
 * Positional input row handed to {@link Expression#eval(Row)}.
 *
 * <p>The optimizer itself only ever evaluates foldable expressions, which read
 * no columns, so it passes {@link #EMPTY}.
 */
public final class Row {

    /** Row with no columns. */
    public static final Row EMPTY = new Row(new Object[0]);

    private final Object[] values;

    private Row(Object[] values) {
        this.values = values;
    }

    /**
     * Creates a row holding the given values.
     *
     * @param values the column values, nulls allowed
     * @return the row
     */
    public static Row of(Object... values) {
        return values.length == 0 ? EMPTY : new Row(values.clone());
    }

    public int size() {
        return values.length;
    }

    /**
     * Returns the value at the given position.
     *
     * @param ordinal the zero-based column position
     * @return the value, or null for SQL NULL
     * @throws EvaluationException if the row has no such column
     */
    public Object get(int ordinal) {
        if (ordinal < 0 || ordinal >= values.length) {
            throw new EvaluationException(
                "Row of size " + values.length + " has no column at ordinal " + ordinal);
        }
        return values[ordinal];
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Row)) return false;
        return Arrays.equals(values, ((Row) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(values);
    }
}
