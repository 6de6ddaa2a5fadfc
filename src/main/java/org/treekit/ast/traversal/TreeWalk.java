package org.treekit.ast.traversal;

import org.treekit.ast.core.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Stateless traversal algorithms over the node kernel.
 * <p>
 * They work on any mix of representation strategies. All of them assume a finite tree: a graph
 * with a cycle makes them loop forever. Use {@code StructuralValidator} to check untrusted graphs
 * first.
 */
public final class TreeWalk {

    private TreeWalk() {}

    /**
     * Visits {@code root}, then each child subtree left to right.
     */
    public static void preorder(Node root, Consumer<? super Node> visit) {
        visit.accept(root);
        for (Node child : root.children()) {
            preorder(child, visit);
        }
    }

    /**
     * Visits each child subtree left to right, then {@code root}.
     */
    public static void postorder(Node root, Consumer<? super Node> visit) {
        for (Node child : root.children()) {
            postorder(child, visit);
        }
        visit.accept(root);
    }

    /**
     * Visits nodes breadth-first, each level left to right.
     */
    public static void levelOrder(Node root, Consumer<? super Node> visit) {
        Deque<Node> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            visit.accept(node);
            queue.addAll(node.children());
        }
    }

    /**
     * Preorder walk that also passes each node's distance from {@code root} (the root has depth 0).
     */
    public static void withDepth(Node root, ObjIntConsumer<? super Node> visit) {
        withDepth(root, 0, visit);
    }

    private static void withDepth(Node node, int depth, ObjIntConsumer<? super Node> visit) {
        visit.accept(node, depth);
        for (Node child : node.children()) {
            withDepth(child, depth + 1, visit);
        }
    }

    /**
     * Lazily yields the nodes of the given kind in preorder. The returned {@link Iterable} can be
     * iterated any number of times; each iteration walks the tree afresh.
     *
     * @param root The root of the tree.
     * @param kind The kind to search for.
     * @return A restartable sequence of matches.
     */
    public static <T> Iterable<T> findAll(Node root, Class<T> kind) {
        return () -> new MatchIterator<>(new PreorderIterator(root), kind);
    }

    /**
     * @return The first node of the given kind in preorder, if any.
     */
    public static <T> Optional<T> findFirst(Node root, Class<T> kind) {
        Iterator<T> matches = findAll(root, kind).iterator();
        return matches.hasNext() ? Optional.of(matches.next()) : Optional.empty();
    }

    /**
     * @return All nodes of the tree in preorder as a lazy stream.
     */
    public static Stream<Node> stream(Node root) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(
                new PreorderIterator(root), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * @return The nodes of the tree in preorder.
     */
    public static List<Node> preorderList(Node root) {
        List<Node> nodes = new ArrayList<>();
        preorder(root, nodes::add);
        return nodes;
    }

    private static final class PreorderIterator implements Iterator<Node> {
        private final Deque<Node> stack = new ArrayDeque<>();

        PreorderIterator(Node root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node node = stack.pop();
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return node;
        }
    }

    private static final class MatchIterator<T> implements Iterator<T> {
        private final Iterator<Node> nodes;
        private final Class<T> kind;
        private T pending;

        MatchIterator(Iterator<Node> nodes, Class<T> kind) {
            this.nodes = nodes;
            this.kind = kind;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && nodes.hasNext()) {
                pending = nodes.next().as(kind).orElse(null);
            }
            return pending != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T match = pending;
            pending = null;
            return match;
        }
    }
}
