package org.treekit.ast.core;

import java.util.List;
import java.util.Optional;

/**
 * A node kind whose fields are all scalars and which therefore never has children.
 * <p>
 * Implementing this interface selects the layout-optimized strategy: children, depth, node count
 * and search answer in constant time without allocating or recursing. Observable results are the
 * same as for the generic algorithms in {@link Node}.
 */
public interface LeafNode extends Node {

    /** The single shared child list of every leaf. */
    List<Node> NO_CHILDREN = List.of();

    @Override
    default List<Node> children() {
        return NO_CHILDREN;
    }

    @Override
    default boolean isLeaf() {
        return true;
    }

    @Override
    default int depth() {
        return 0;
    }

    @Override
    default int nodeCount() {
        return 1;
    }

    @Override
    default <T> List<T> findAll(Class<T> kind) {
        Optional<T> self = as(kind);
        return self.isPresent() ? List.of(self.get()) : List.of();
    }

    @Override
    default <T> Optional<T> findFirst(Class<T> kind) {
        return as(kind);
    }

    @Override
    default boolean contains(Class<?> kind) {
        return is(kind);
    }
}
