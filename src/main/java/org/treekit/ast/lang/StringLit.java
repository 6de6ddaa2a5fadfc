package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;

import java.util.List;
import java.util.Objects;

/**
 * A string literal.
 */
public record StringLit(Span span, String value) implements Expr, DisplayField {

    public StringLit {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitStringLit(this);
    }

    @Override
    public StringLit deepCopy() {
        return new StringLit(span, value);
    }

    @Override
    public String displayValue() {
        return value;
    }
}
