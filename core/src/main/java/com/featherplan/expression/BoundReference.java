package com.featherplan.expression;

import com.featherplan.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Reads one slot of the input row by position.
 *
 * <p>Physical planning binds attribute references to ordinals; the optimizer
 * only encounters these in expressions handed to it pre-bound. Never foldable.
 */
public final class BoundReference implements Expression {

    private final int ordinal;
    private final DataType dataType;
    private final boolean nullable;

    public BoundReference(int ordinal, DataType dataType, boolean nullable) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative");
        }
        this.ordinal = ordinal;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    public int ordinal() {
        return ordinal;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public Object eval(Row input) {
        return input.get(ordinal);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("BoundReference has no children");
        }
        return this;
    }

    @Override
    public String toString() {
        return "input[" + ordinal + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BoundReference)) return false;
        BoundReference that = (BoundReference) obj;
        return ordinal == that.ordinal &&
               nullable == that.nullable &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordinal, dataType, nullable);
    }
}
