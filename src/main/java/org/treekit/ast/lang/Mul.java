package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Integer multiplication, {@code left * right}.
 */
public record Mul(Span span, Expr left, Expr right) implements Expr {

    public Mul {
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
        return ExprVisitor.of(visitor).visitMul(this);
    }

    @Override
    public Mul deepCopy() {
        return new Mul(span, (Expr) left.deepCopy(), (Expr) right.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 2, 2);
        return new Mul(span, ChildSlots.slot(this, newChildren, 0, Expr.class),
                ChildSlots.slot(this, newChildren, 1, Expr.class));
    }
}
