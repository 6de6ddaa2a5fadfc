package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;

import java.util.List;
import java.util.Objects;

/**
 * A boolean literal.
 */
public record BoolLit(Span span, boolean value) implements Expr, DisplayField {

    public BoolLit {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitBoolLit(this);
    }

    @Override
    public BoolLit deepCopy() {
        return new BoolLit(span, value);
    }

    @Override
    public String displayValue() {
        return Boolean.toString(value);
    }
}
