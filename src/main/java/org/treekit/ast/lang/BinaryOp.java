package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.validation.Validatable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A binary operation with an explicit operator, see {@link Operators#BINARY}.
 */
public record BinaryOp(Span span, Expr left, String operator, Expr right) implements Expr, Validatable {

    public BinaryOp {
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
        return ExprVisitor.of(visitor).visitBinaryOp(this);
    }

    @Override
    public BinaryOp deepCopy() {
        return new BinaryOp(span, (Expr) left.deepCopy(), operator, (Expr) right.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 2, 2);
        return new BinaryOp(span, ChildSlots.slot(this, newChildren, 0, Expr.class), operator,
                ChildSlots.slot(this, newChildren, 1, Expr.class));
    }

    @Override
    public List<Diagnostic> validate() {
        List<Diagnostic> found = new ArrayList<>();
        if (!Operators.BINARY.contains(operator)) {
            found.add(Diagnostic.error("Unknown binary operator '" + operator + "'")
                    .primary(span, "here")
                    .note("supported operators: " + String.join(" ", Operators.BINARY.stream().sorted().toList()))
                    .build());
        }
        if ((operator.equals("/") || operator.equals("%")) && Operators.intConstant(right).filter(v -> v == 0).isPresent()) {
            found.add(Diagnostic.warning("Division by zero")
                    .primary(right.span(), "divisor is zero")
                    .secondary(span, "in this operation")
                    .build());
        }
        return found;
    }
}
