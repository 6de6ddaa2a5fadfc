package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.validation.Validatable;

import java.util.List;
import java.util.Objects;

/**
 * A prefix operation: arithmetic negation or logical not.
 */
public record UnaryOp(Span span, String operator, Expr operand) implements Expr, Validatable {

    public UnaryOp {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<Node> children() {
        return List.of(operand);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitUnaryOp(this);
    }

    @Override
    public UnaryOp deepCopy() {
        return new UnaryOp(span, operator, (Expr) operand.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 1, 1);
        return new UnaryOp(span, operator, ChildSlots.slot(this, newChildren, 0, Expr.class));
    }

    @Override
    public List<Diagnostic> validate() {
        if (Operators.UNARY.contains(operator)) {
            return List.of();
        }
        return List.of(Diagnostic.error("Unknown unary operator '" + operator + "'").primary(span, "here").build());
    }
}
