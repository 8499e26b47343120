package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing UNION ALL of two or more inputs.
 *
 * <p>Inputs are positionally compatible; the output takes the attributes of
 * the first input.
 */
public final class Union extends LogicalPlan {

    /**
     * Creates a union node.
     *
     * @param inputs the inputs, at least two
     */
    public Union(List<LogicalPlan> inputs) {
        super(Objects.requireNonNull(inputs, "inputs must not be null"));
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("Union requires at least two inputs");
        }
    }

    @Override
    public List<AttributeReference> output() {
        return children.get(0).output();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        return new Union(newChildren);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Union)) return false;
        return children.equals(((Union) obj).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash("union", children);
    }

    @Override
    public String toString() {
        return "Union";
    }
}
