package com.featherplan.expression;

import com.featherplan.tree.TreeNode;
import com.featherplan.types.DataType;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Base interface for all expressions seen by the optimizer.
 *
 * <p>Expressions are immutable trees. Besides the structural operations
 * inherited from {@link TreeNode}, every node reports its type, whether it can
 * be computed without an input row ({@link #foldable()}), and which columns it
 * reads ({@link #references()}).
 *
 * <p>The set of expression kinds is open: the rewrite engine and the rules
 * only rely on the methods declared here, so new kinds can be added without
 * touching them.
 */
public interface Expression extends TreeNode<Expression> {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Evaluates this expression against an input row.
     *
     * @param input the row to read columns from
     * @return the value, or null for SQL NULL
     * @throws EvaluationException if no value can be produced
     */
    Object eval(Row input);

    /**
     * Returns whether the value of this expression is fixed at plan time.
     *
     * <p>By default a node is foldable when it is deterministic and has at least
     * one child, all of them foldable. Leaves decide for themselves.
     *
     * @return true if the expression reads no input and always yields the same value
     */
    default boolean foldable() {
        if (!deterministic() || children().isEmpty()) {
            return false;
        }
        for (Expression child : children()) {
            if (!child.foldable()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether evaluating this expression twice on the same row always
     * gives the same result.
     *
     * @return true unless this node or a descendant is non-deterministic
     */
    default boolean deterministic() {
        for (Expression child : children()) {
            if (!child.deterministic()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the attributes this expression reads. Membership follows
     * attribute identity, not name.
     *
     * @return an unmodifiable, insertion-ordered set of attributes
     */
    default Set<AttributeReference> references() {
        if (children().isEmpty()) {
            return Collections.emptySet();
        }
        Set<AttributeReference> refs = new LinkedHashSet<>();
        for (Expression child : children()) {
            refs.addAll(child.references());
        }
        return Collections.unmodifiableSet(refs);
    }
}
