package org.treekit.ast.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for {@link Node#withChildren(List)} implementations that map a flat child list back
 * onto typed fields.
 */
public final class ChildSlots {

    private ChildSlots() {}

    /**
     * Checks the size of a replacement child list.
     * @param owner    The node being rebuilt.
     * @param children The replacement children.
     * @param min      The minimum accepted size.
     * @param max      The maximum accepted size.
     */
    public static void requireSize(Node owner, List<Node> children, int min, int max) {
        int size = children.size();
        if (size < min || size > max) {
            throw new NodeContractException(String.format(
                    "%s cannot be rebuilt from %d children (expected %d..%d)",
                    owner.getClass().getSimpleName(), size, min, max));
        }
    }

    /**
     * Reads one child and checks its kind.
     * @param owner    The node being rebuilt.
     * @param children The replacement children.
     * @param index    The position of the field.
     * @param type     The kind the field accepts.
     * @return The typed child.
     */
    public static <N> N slot(Node owner, List<Node> children, int index, Class<N> type) {
        Node child = children.get(index);
        if (!type.isInstance(child)) {
            throw new NodeContractException(String.format(
                    "%s child %d must be a %s but was %s",
                    owner.getClass().getSimpleName(), index, type.getSimpleName(),
                    child == null ? "null" : child.getClass().getSimpleName()));
        }
        return type.cast(child);
    }

    /**
     * Reads all children from {@code from} to the end as a list field.
     * @param owner    The node being rebuilt.
     * @param children The replacement children.
     * @param from     The first index of the list field.
     * @param type     The element kind the field accepts.
     * @return The typed list.
     */
    public static <N> List<N> rest(Node owner, List<Node> children, int from, Class<N> type) {
        List<N> result = new ArrayList<>(children.size() - from);
        for (int i = from; i < children.size(); i++) {
            result.add(slot(owner, children, i, type));
        }
        return result;
    }
}
