package org.treekit.ast.lang.optimized;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.LeafNode;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;

import java.util.Objects;

/**
 * String literal with constant-time leaf operations.
 */
public record OptStringLit(Span span, String value) implements Expr, LeafNode, DisplayField {

    public OptStringLit {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitOptStringLit(this);
    }

    @Override
    public OptStringLit deepCopy() {
        return new OptStringLit(span, value);
    }

    @Override
    public String displayValue() {
        return value;
    }
}
