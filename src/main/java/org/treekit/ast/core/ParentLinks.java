package org.treekit.ast.core;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The optional, non-owning parent relation of a tree.
 * <p>
 * Nodes do not know their parents. Whoever assembles a tree may build this index to answer
 * ancestor and sibling queries. Parents are held weakly and the relation never drives ownership or
 * lifetime. Nodes are keyed by identity, so two equal subtrees keep separate links. A shared leaf
 * (for example a pooled literal) reports the parent that linked it last.
 */
public final class ParentLinks {

    private final Map<Node, WeakReference<Node>> parents = new IdentityHashMap<>();

    /**
     * Indexes every parent/child edge reachable from {@code root}.
     * @param root The root of the tree.
     * @return The index.
     */
    public static ParentLinks index(Node root) {
        ParentLinks links = new ParentLinks();
        links.indexSubtree(root);
        return links;
    }

    /**
     * Adds the edges of the subtree rooted at {@code root}. A child that is already linked is linked
     * again but not descended into, so indexing always terminates.
     * @param root The subtree root.
     */
    public void indexSubtree(Node root) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node parent = pending.pop();
            for (Node child : parent.children()) {
                boolean seen = parents.containsKey(child) || child == root;
                link(parent, child);
                if (!seen) {
                    pending.push(child);
                }
            }
        }
    }

    /**
     * Records {@code parent} as the parent of {@code child}.
     */
    public void link(Node parent, Node child) {
        parents.put(child, new WeakReference<>(parent));
    }

    /**
     * @param node The node to look up.
     * @return The parent, if linked and still reachable.
     */
    public Optional<Node> parentOf(Node node) {
        WeakReference<Node> ref = parents.get(node);
        return ref == null ? Optional.empty() : Optional.ofNullable(ref.get());
    }

    /**
     * @param node The node to start from.
     * @return The chain of parents, nearest first, ending at the root.
     */
    public List<Node> ancestors(Node node) {
        List<Node> result = new ArrayList<>();
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(node);
        Optional<Node> current = parentOf(node);
        while (current.isPresent() && seen.add(current.get())) {
            result.add(current.get());
            current = parentOf(current.get());
        }
        return result;
    }

    /**
     * @param node The node whose siblings are requested.
     * @return The other children of the node's parent, in order; empty for the root.
     */
    public List<Node> siblings(Node node) {
        Optional<Node> parent = parentOf(node);
        if (parent.isEmpty()) {
            return List.of();
        }
        List<Node> result = new ArrayList<>();
        for (Node child : parent.get().children()) {
            if (child != node) {
                result.add(child);
            }
        }
        return result;
    }

    public boolean isAncestorOf(Node candidate, Node node) {
        return containsIdentity(ancestors(node), candidate);
    }

    public boolean isDescendantOf(Node node, Node candidate) {
        return containsIdentity(ancestors(node), candidate);
    }

    /**
     * @return The number of linked children.
     */
    public int size() {
        return parents.size();
    }

    private static boolean containsIdentity(List<Node> nodes, Node wanted) {
        for (Node n : nodes) {
            if (n == wanted) {
                return true;
            }
        }
        return false;
    }
}
