package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a relation known to be empty.
 *
 * <p>The optimizer substitutes it for subtrees that can never produce a row,
 * keeping the original output attributes so that operators above it still
 * resolve their references.
 */
public final class LocalRelation extends LogicalPlan {

    private final List<AttributeReference> output;

    /**
     * Creates an empty local relation.
     *
     * @param output the attributes the relation produces
     */
    public LocalRelation(List<AttributeReference> output) {
        super(); // No children
        this.output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("LocalRelation has no children");
        }
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LocalRelation)) return false;
        return output.equals(((LocalRelation) obj).output);
    }

    @Override
    public int hashCode() {
        return Objects.hash("local", output);
    }

    @Override
    public String toString() {
        return String.format("LocalRelation %s", output);
    }
}
