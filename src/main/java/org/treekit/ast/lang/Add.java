package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Integer addition, {@code left + right}.
 */
public record Add(Span span, Expr left, Expr right) implements Expr {

    public Add {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitAdd(this);
    }

    @Override
    public Add deepCopy() {
        return new Add(span, (Expr) left.deepCopy(), (Expr) right.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 2, 2);
        return new Add(span, ChildSlots.slot(this, newChildren, 0, Expr.class),
                ChildSlots.slot(this, newChildren, 1, Expr.class));
    }
}
