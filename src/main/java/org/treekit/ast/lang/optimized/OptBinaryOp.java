package org.treekit.ast.lang.optimized;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Binary operation in the optimized layout. Equality short-circuits on identity before comparing
 * the subtrees, which pays off for trees that share subtrees after rewriting.
 */
public record OptBinaryOp(Span span, Expr left, String operator, Expr right) implements Expr {

    public OptBinaryOp {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitOptBinaryOp(this);
    }

    @Override
    public OptBinaryOp deepCopy() {
        return new OptBinaryOp(span, (Expr) left.deepCopy(), operator, (Expr) right.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 2, 2);
        return new OptBinaryOp(span, ChildSlots.slot(this, newChildren, 0, Expr.class), operator,
                ChildSlots.slot(this, newChildren, 1, Expr.class));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptBinaryOp other)) return false;
        return operator.equals(other.operator)
                && span.equals(other.span)
                && (left == other.left || left.equals(other.left))
                && (right == other.right || right.equals(other.right));
    }

    @Override
    public int hashCode() {
        return Objects.hash(span, left, operator, right);
    }
}
