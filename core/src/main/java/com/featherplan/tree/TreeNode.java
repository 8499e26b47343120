package com.featherplan.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Generic immutable tree node shared by expression trees and plan trees.
 *
 * <p>All rewrites are pure: a transform never mutates a node, it returns either
 * the same instance (nothing changed) or a new node built from rewritten
 * children. Unchanged subtrees are shared between input and output trees.
 *
 * <p>Rewrite functions are plain {@link UnaryOperator}s written as
 * match-and-default code: a node shape the function does not handle must be
 * returned as-is. Change detection compares children by reference, so a rule
 * that does not match must return its argument, not a copy.
 *
 * @param <T> the concrete node family (expressions or logical plans)
 */
public interface TreeNode<T extends TreeNode<T>> {

    /**
     * Returns the child nodes, in a stable order.
     *
     * @return an unmodifiable list of children
     */
    List<T> children();

    /**
     * Returns a copy of this node with the given children, keeping every other
     * field. The list must have the same size as {@link #children()}.
     *
     * @param newChildren the replacement children
     * @return the rebuilt node
     */
    T withNewChildren(List<T> newChildren);

    @SuppressWarnings("unchecked")
    private T self() {
        return (T) this;
    }

    /**
     * Pre-order rewrite: applies {@code rule} to this node first, then recurses
     * into the children of the node the rule returned.
     *
     * @param rule the rewrite function
     * @return the rewritten tree
     */
    default T transformDown(UnaryOperator<T> rule) {
        T afterRule = rule.apply(self());
        return afterRule.mapChildren(child -> child.transformDown(rule));
    }

    /**
     * Post-order rewrite: rewrites all children first, rebuilds this node if any
     * child changed, then applies {@code rule} to the rebuilt node.
     *
     * @param rule the rewrite function
     * @return the rewritten tree
     */
    default T transformUp(UnaryOperator<T> rule) {
        T afterChildren = mapChildren(child -> child.transformUp(rule));
        return rule.apply(afterChildren);
    }

    /**
     * Returns this node rebuilt with {@code fn} applied to each child, or this
     * very instance when {@code fn} returned every child unchanged.
     *
     * @param fn the child mapping
     * @return the rebuilt node or {@code this}
     */
    default T mapChildren(UnaryOperator<T> fn) {
        List<T> current = children();
        if (current.isEmpty()) {
            return self();
        }
        boolean changed = false;
        List<T> mapped = new ArrayList<>(current.size());
        for (T child : current) {
            T newChild = fn.apply(child);
            if (newChild == null) {
                throw new IllegalStateException("Rewrite returned null for " + child);
            }
            if (newChild != child) {
                changed = true;
            }
            mapped.add(newChild);
        }
        return changed ? withNewChildren(mapped) : self();
    }

    /**
     * Visits this node and then every descendant, pre-order.
     *
     * @param visitor the callback
     */
    default void foreach(Consumer<T> visitor) {
        visitor.accept(self());
        for (T child : children()) {
            child.foreach(visitor);
        }
    }

    /**
     * Collects a value from every node, pre-order, for which {@code fn} returns
     * a present result.
     *
     * @param fn the extraction function
     * @param <R> the collected type
     * @return the collected values in visit order
     */
    default <R> List<R> collect(Function<T, Optional<R>> fn) {
        List<R> result = new ArrayList<>();
        foreach(node -> fn.apply(node).ifPresent(result::add));
        return result;
    }

    /**
     * Returns the first node, pre-order, that satisfies {@code predicate}.
     *
     * @param predicate the condition
     * @return the matching node, if any
     */
    default Optional<T> find(Predicate<T> predicate) {
        if (predicate.test(self())) {
            return Optional.of(self());
        }
        for (T child : children()) {
            Optional<T> found = child.find(predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the number of nodes in this tree.
     *
     * @return the node count, including this node
     */
    default int size() {
        int count = 1;
        for (T child : children()) {
            count += child.size();
        }
        return count;
    }
}
