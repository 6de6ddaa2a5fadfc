package org.treekit.ast.core.repr;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;

/**
 * A leaf kind represented as a plain value, typically a small record.
 * <p>
 * Value leaves do not implement {@link org.treekit.ast.core.Node} themselves. They enter a tree
 * through {@link ValueNode}, which forwards every kernel operation to the value. Equality is value
 * equality, so records get it for free.
 */
public interface ValueLeaf {

    Span span();

    <T> T accept(NodeVisitor<T> visitor);

    /**
     * @return A copy of this value; immutable values return themselves.
     */
    default ValueLeaf deepCopy() {
        return this;
    }
}
