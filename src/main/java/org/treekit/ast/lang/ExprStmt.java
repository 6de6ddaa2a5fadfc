package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * An expression evaluated for its effect.
 */
public record ExprStmt(Span span, Expr expression) implements Stmt {

    public ExprStmt {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public List<Node> children() {
        return List.of(expression);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitExprStmt(this);
    }

    @Override
    public ExprStmt deepCopy() {
        return new ExprStmt(span, (Expr) expression.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 1, 1);
        return new ExprStmt(span, ChildSlots.slot(this, newChildren, 0, Expr.class));
    }
}
