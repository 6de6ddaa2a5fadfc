package org.treekit.ast.core.repr;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.LeafNode;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.DisplayField;

import java.util.Objects;

/**
 * Base class of pooled leaf kinds: immutable single-value leaves that a {@code NodePool} may hand
 * out as shared instances.
 * <p>
 * Subclasses are final, keep their constructor private and expose a static {@code of(pool, span,
 * value)} factory that goes through the pool. Because instances can be shared, {@link #deepCopy()}
 * returns the instance itself, and the span of a shared instance is the span it was first created
 * with.
 *
 * @param <V> The type of the single scalar value.
 */
public abstract class PooledLeaf<V> implements LeafNode, DisplayField {

    private final Span span;
    private final V value;

    protected PooledLeaf(Span span, V value) {
        this.span = Objects.requireNonNull(span, "span");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Span span() {
        return span;
    }

    public V value() {
        return value;
    }

    @Override
    public final Node deepCopy() {
        return this;
    }

    @Override
    public String displayValue() {
        return String.valueOf(value);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PooledLeaf<?> other = (PooledLeaf<?>) o;
        return span.equals(other.span) && value.equals(other.value);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass().getName(), span, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[span=" + span + ", value=" + value + "]";
    }
}
