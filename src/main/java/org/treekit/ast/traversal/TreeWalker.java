package org.treekit.ast.traversal;

import org.treekit.ast.core.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A handler-based tree walker.
 * Instead of a full visitor, callers register handlers for the node kinds they care about,
 * which keeps passes decoupled from the set of kinds a grammar declares.
 * Like every traversal in this package, the walker assumes a finite tree.
 */
public class TreeWalker {

    private final Map<Class<? extends Node>, Consumer<Node>> handlers;
    private final Consumer<Node> everyNode;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends Node>, Consumer<Node>> handlers) {
        this(handlers, n -> {});
    }

    /**
     * Constructs a new TreeWalker.
     * @param handlers  A map from node classes to their corresponding handlers.
     * @param everyNode Runs for every node before its kind-specific handler.
     */
    public TreeWalker(Map<Class<? extends Node>, Consumer<Node>> handlers, Consumer<Node> everyNode) {
        this.handlers = handlers;
        this.everyNode = everyNode;
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends Node> nodes) {
        for (Node node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its children in preorder.
     * @param node The node to walk.
     */
    public void walk(Node node) {
        if (node == null) {
            return;
        }

        everyNode.accept(node);
        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (Node child : node.children()) {
            walk(child);
        }
    }

    /**
     * Transforms a tree by replacing nodes according to a replacement map.
     * Changed ancestors are rebuilt through {@link Node#withChildren(List)}, so this works without
     * knowledge of specific node kinds. Keys are matched with the map's own key semantics; pass an
     * {@link java.util.IdentityHashMap} to replace one particular occurrence of a repeated subtree.
     *
     * @param node         The root node to transform.
     * @param replacements A map from old nodes to their replacements.
     * @return The transformed node, or {@code node} itself if nothing was replaced.
     */
    public Node transform(Node node, Map<Node, Node> replacements) {
        if (node == null) {
            return null;
        }
        if (replacements.containsKey(node)) {
            return replacements.get(node);
        }

        List<Node> children = node.children();
        List<Node> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;
        for (Node child : children) {
            Node transformedChild = transform(child, replacements);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        return childrenChanged ? node.withChildren(transformedChildren) : node;
    }
}
