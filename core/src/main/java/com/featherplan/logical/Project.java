package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import com.featherplan.expression.NamedExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>Each projection is a named expression: either a column passed through
 * from the child or an {@link com.featherplan.expression.Alias} that defines
 * a new column. The output is the attribute of each projection, in order.
 *
 * <p>Examples:
 * <pre>
 *   SELECT name, age FROM t
 *   SELECT price * 1.1 AS gross FROM t
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<NamedExpression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projection expressions
     */
    public Project(LogicalPlan child, List<? extends NamedExpression> projections) {
        super(child);
        this.projections = List.copyOf(Objects.requireNonNull(projections, "projections must not be null"));

        if (this.projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
    }

    public List<NamedExpression> projections() {
        return projections;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(projections.size());
        for (NamedExpression projection : projections) {
            output.add(projection.toAttribute());
        }
        return output;
    }

    @Override
    public List<Expression> expressions() {
        return List.copyOf(projections);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        boolean changed = false;
        List<NamedExpression> mapped = new ArrayList<>(projections.size());
        for (NamedExpression projection : projections) {
            Expression rewritten = fn.apply(projection);
            if (!(rewritten instanceof NamedExpression)) {
                throw new IllegalStateException(
                    "Projection " + projection + " was rewritten to unnamed expression " + rewritten);
            }
            if (rewritten != projection) {
                changed = true;
            }
            mapped.add((NamedExpression) rewritten);
        }
        return changed ? new Project(child(), mapped) : this;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("Project expects exactly one child");
        }
        return new Project(newChildren.get(0), projections);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Project)) return false;
        Project that = (Project) obj;
        return projections.equals(that.projections) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(projections, child());
    }

    @Override
    public String toString() {
        return String.format("Project %s", projections);
    }
}
