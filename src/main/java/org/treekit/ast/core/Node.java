package org.treekit.ast.core;

import org.treekit.ast.api.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The base contract every concrete node kind satisfies.
 * <p>
 * A kind implements the four primitives {@link #children()}, {@link #accept(NodeVisitor)},
 * {@link #deepCopy()} and structural {@link #equals(Object)}/{@link #hashCode()}; everything else
 * is derived here once. Fields are fixed for the lifetime of a node, so "editing" a tree means
 * building replacement nodes.
 * <p>
 * All derived operations assume a finite tree. A graph with a cycle makes them recurse without
 * bound; only {@code StructuralValidator} is safe to run on such input.
 */
public interface Node {

    /**
     * @return The source location of this node.
     */
    Span span();

    /**
     * Returns the node-typed fields of this node in declared field order. Absent optional children
     * are skipped, list fields contribute all their elements, scalar fields never appear.
     *
     * @return The direct children; empty for leaves.
     */
    List<Node> children();

    /**
     * Dispatches to the visitor method bound to this concrete kind.
     *
     * @param visitor The visitor.
     * @param <T>     The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <T> T accept(NodeVisitor<T> visitor);

    /**
     * Creates a deep copy equal to this node. Immutable pooled and value leaves may return themselves.
     *
     * @return The copy.
     */
    Node deepCopy();

    /**
     * Deep structural equality: same concrete kind, equal spans, equal scalar fields and pairwise-equal
     * children in order.
     */
    @Override
    boolean equals(Object other);

    @Override
    int hashCode();

    /**
     * @return The runtime kind of this node as seen by registries and renderers.
     */
    default Class<?> kindType() {
        return getClass();
    }

    default boolean isLeaf() {
        return children().isEmpty();
    }

    /**
     * @return 0 for leaves, otherwise one more than the deepest child.
     */
    default int depth() {
        List<Node> children = children();
        if (children.isEmpty()) {
            return 0;
        }
        int deepest = 0;
        for (Node child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }

    /**
     * @return The number of nodes in the subtree rooted at this node, including itself.
     */
    default int nodeCount() {
        int count = 1;
        for (Node child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    /**
     * Collects all nodes of the given kind in preorder.
     *
     * @param kind The kind to search for; interfaces such as {@code Expr} match every implementing kind.
     * @return An unmodifiable list of matches.
     */
    default <T> List<T> findAll(Class<T> kind) {
        List<T> found = new ArrayList<>();
        as(kind).ifPresent(found::add);
        for (Node child : children()) {
            found.addAll(child.findAll(kind));
        }
        return Collections.unmodifiableList(found);
    }

    /**
     * @param kind The kind to search for.
     * @return The first node of that kind in preorder, if any.
     */
    default <T> Optional<T> findFirst(Class<T> kind) {
        Optional<T> self = as(kind);
        if (self.isPresent()) {
            return self;
        }
        for (Node child : children()) {
            Optional<T> hit = child.findFirst(kind);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    default boolean contains(Class<?> kind) {
        return findFirst(kind).isPresent();
    }

    /**
     * Type predicate.
     *
     * @param kind The kind to test against.
     * @return {@code true} if this node is of the given kind.
     */
    default boolean is(Class<?> kind) {
        return kind.isInstance(this);
    }

    /**
     * Narrows this node to the given kind.
     *
     * @param kind The kind to narrow to.
     * @return This node as {@code kind}, or empty if it is of another kind.
     */
    default <T> Optional<T> as(Class<T> kind) {
        return kind.isInstance(this) ? Optional.of(kind.cast(this)) : Optional.empty();
    }

    /**
     * Creates a new instance of this node with the given children in place of the current ones.
     * This allows generic rewriting without knowing the concrete kind. The list must have the shape
     * {@link #children()} returns; kinds that cannot be rebuilt return this node unchanged.
     *
     * @param newChildren The replacement children in declared field order.
     * @return The rebuilt node.
     */
    default Node withChildren(List<Node> newChildren) {
        return this;
    }
}
