package org.treekit.ast.lang.value;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.ValueLeaf;
import org.treekit.ast.lang.ExprVisitor;

import java.util.Objects;

/**
 * Boolean literal as a value type.
 */
public record BoolValue(Span span, boolean value) implements ValueLeaf {

    public BoolValue {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitBoolValue(this);
    }
}
