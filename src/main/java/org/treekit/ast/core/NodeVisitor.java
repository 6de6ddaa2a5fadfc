package org.treekit.ast.core;

/**
 * A visitor computing a result of type {@code T} per node kind.
 * <p>
 * Grammars extend this interface with one {@code visit<Kind>} method per concrete kind.
 * {@link #visit(Node)} is the generic entry point: it lets the node pick the kind-specific method.
 * Exceptions thrown by visitor methods propagate to the caller unchanged.
 *
 * @param <T> The result type of the visit methods.
 */
public interface NodeVisitor<T> {

    /**
     * Double dispatch entry point.
     *
     * @param node The node to visit.
     * @return The result of the kind-specific visit method.
     */
    default T visit(Node node) {
        return node.accept(this);
    }
}
