package org.treekit.ast.core.repr;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.LeafNode;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.Objects;
import java.util.Optional;

/**
 * Adapts a {@link ValueLeaf} to the {@link Node} contract.
 * <p>
 * Type predicates see through the wrapper: {@code is(IntValue.class)} is {@code true} for a node
 * wrapping an {@code IntValue}, and {@code as(IntValue.class)} yields the wrapped value.
 *
 * @param <V> The wrapped value type.
 */
public final class ValueNode<V extends ValueLeaf> implements LeafNode {

    private final V value;

    private ValueNode(V value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * @param value The value to wrap.
     * @return A node forwarding to {@code value}.
     */
    public static <V extends ValueLeaf> ValueNode<V> of(V value) {
        return new ValueNode<>(value);
    }

    public V value() {
        return value;
    }

    @Override
    public Span span() {
        return value.span();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return value.accept(visitor);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Node deepCopy() {
        return new ValueNode<>((V) value.deepCopy());
    }

    @Override
    public Class<?> kindType() {
        return value.getClass();
    }

    @Override
    public boolean is(Class<?> kind) {
        return kind.isInstance(this) || kind.isInstance(value);
    }

    @Override
    public <T> Optional<T> as(Class<T> kind) {
        if (kind.isInstance(this)) {
            return Optional.of(kind.cast(this));
        }
        return kind.isInstance(value) ? Optional.of(kind.cast(value)) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof ValueNode<?> other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
