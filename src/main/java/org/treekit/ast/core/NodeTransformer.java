package org.treekit.ast.core;

/**
 * A visitor whose result is a node, used to rewrite trees by building replacements.
 */
public interface NodeTransformer extends NodeVisitor<Node> {

    /**
     * Transforms the tree rooted at {@code root}.
     *
     * @param root The root to transform.
     * @return The replacement root, or {@code root} itself if nothing changed.
     */
    default Node transform(Node root) {
        return visit(root);
    }

    /**
     * Visits {@code node} and checks that the replacement still fits the field it came from.
     *
     * @param node     The node to transform.
     * @param expected The kind the owning field accepts.
     * @return The replacement.
     * @throws NodeContractException if the transformer produced a node of an incompatible kind.
     */
    default <N> N transformAs(Node node, Class<N> expected) {
        Node result = visit(node);
        if (!expected.isInstance(result)) {
            throw new NodeContractException(String.format(
                    "Transformer %s replaced %s with %s, expected a %s",
                    getClass().getSimpleName(), node.getClass().getSimpleName(),
                    result == null ? "null" : result.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(result);
    }
}
