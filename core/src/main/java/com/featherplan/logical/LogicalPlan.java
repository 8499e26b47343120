package com.featherplan.logical;

import com.featherplan.expression.AttributeReference;
import com.featherplan.expression.Expression;
import com.featherplan.tree.TreeNode;
import com.featherplan.types.StructField;
import com.featherplan.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Base class for all logical plan nodes.
 *
 * <p>A logical plan describes what a query computes as a tree of relational
 * operators. Nodes are immutable: every rewrite produces new nodes and shares
 * unchanged subtrees with its input.
 *
 * <p>Each node exposes:
 * <ul>
 *   <li>its children ({@link #children()}),</li>
 *   <li>the attributes it produces ({@link #output()}), derived only from its
 *       children and its own fields,</li>
 *   <li>the expressions it owns ({@link #expressions()}), which
 *       {@link #mapExpressions(UnaryOperator)} can rewrite in place of a copy.</li>
 * </ul>
 *
 * <p>The set of node kinds is open. The rewrite primitives below only use these
 * capabilities, so new operators plug in without touching them.
 */
public abstract class LogicalPlan implements TreeNode<LogicalPlan> {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Lazily rendered output schema */
    private StructType schema;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = List.copyOf(children);
    }

    @Override
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the attributes produced by this node, in column order.
     *
     * @return the output attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Returns the identity set of {@link #output()}, for subset tests.
     *
     * @return an unmodifiable set of output attributes
     */
    public Set<AttributeReference> outputSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(output()));
    }

    /**
     * Returns the expression slots owned by this node, not including those of
     * its children.
     *
     * @return the owned expressions, empty by default
     */
    public List<Expression> expressions() {
        return List.of();
    }

    /**
     * Returns this node with {@code fn} applied to each owned expression slot,
     * or this very instance when every slot came back unchanged.
     *
     * @param fn the expression mapping
     * @return the rebuilt node or {@code this}
     */
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        return this;
    }

    /**
     * Returns the attributes referenced by the expressions of this node.
     *
     * @return the referenced attributes
     */
    public Set<AttributeReference> references() {
        Set<AttributeReference> refs = new LinkedHashSet<>();
        for (Expression expression : expressions()) {
            refs.addAll(expression.references());
        }
        return Collections.unmodifiableSet(refs);
    }

    // ==================== Rewrite Primitives ====================

    /**
     * Rewrites the whole plan bottom-up: children are rewritten first, the node
     * is rebuilt if any child changed, then {@code rule} sees the rebuilt node.
     * Every node is visited exactly once.
     *
     * @param rule the plan rewrite, returning its argument where it does not apply
     * @return the rewritten plan
     */
    public LogicalPlan transform(UnaryOperator<LogicalPlan> rule) {
        return transformUp(rule);
    }

    /**
     * Rewrites the expressions owned by this node, pre-order. Children plans
     * are not visited.
     *
     * @param rule the expression rewrite
     * @return the rebuilt node, or {@code this} if nothing changed
     */
    public LogicalPlan transformExpressionsDown(UnaryOperator<Expression> rule) {
        return mapExpressions(expression -> expression.transformDown(rule));
    }

    /**
     * Rewrites the expressions owned by this node, post-order. Children plans
     * are not visited.
     *
     * @param rule the expression rewrite
     * @return the rebuilt node, or {@code this} if nothing changed
     */
    public LogicalPlan transformExpressionsUp(UnaryOperator<Expression> rule) {
        return mapExpressions(expression -> expression.transformUp(rule));
    }

    /**
     * Applies {@code rule} to every expression anywhere in the plan.
     *
     * @param rule the expression rewrite
     * @return the rewritten plan
     */
    public LogicalPlan transformAllExpressions(UnaryOperator<Expression> rule) {
        return transform(plan -> plan.transformExpressionsDown(rule));
    }

    // ==================== Display ====================

    /**
     * Renders {@link #output()} as a name-based schema.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            List<StructField> fields = new ArrayList<>();
            for (AttributeReference attribute : output()) {
                fields.add(new StructField(attribute.name(), attribute.dataType(), attribute.nullable()));
            }
            schema = new StructType(fields);
        }
        return schema;
    }

    /**
     * Returns the plan as an indented multi-line tree, one node per line.
     *
     * @return the tree rendering
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, "", "");
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, String firstPrefix, String restPrefix) {
        sb.append(firstPrefix).append(this).append('\n');
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            children.get(i).appendTree(sb,
                restPrefix + (last ? "+- " : ":- "),
                restPrefix + (last ? "   " : ":  "));
        }
    }

    /**
     * Returns a one-line description of this node, without its children.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
