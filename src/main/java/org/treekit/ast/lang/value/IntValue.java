package org.treekit.ast.lang.value;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.ValueLeaf;
import org.treekit.ast.core.DisplayField;
import org.treekit.ast.lang.ExprVisitor;

import java.util.Objects;

/**
 * Integer literal as a value type. Wrap it in a {@link org.treekit.ast.core.repr.ValueNode} to
 * place it in a tree.
 */
public record IntValue(Span span, int value) implements ValueLeaf, DisplayField {

    public IntValue {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitIntValue(this);
    }

    @Override
    public String displayValue() {
        return Integer.toString(value);
    }
}
