package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;

import java.util.List;
import java.util.Objects;

/**
 * An integer literal.
 */
public record IntLit(Span span, int value) implements Expr, DisplayField {

    public IntLit {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitIntLit(this);
    }

    @Override
    public IntLit deepCopy() {
        return new IntLit(span, value);
    }

    @Override
    public String displayValue() {
        return Integer.toString(value);
    }
}
