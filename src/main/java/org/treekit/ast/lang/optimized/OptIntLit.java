package org.treekit.ast.lang.optimized;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.LeafNode;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;

import java.util.Objects;

/**
 * Integer literal with constant-time leaf operations.
 */
public record OptIntLit(Span span, int value) implements Expr, LeafNode, DisplayField {

    public OptIntLit {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitOptIntLit(this);
    }

    @Override
    public OptIntLit deepCopy() {
        return new OptIntLit(span, value);
    }

    @Override
    public String displayValue() {
        return Integer.toString(value);
    }
}
