package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A function call {@code callee(arguments...)}.
 */
public record Call(Span span, Identifier callee, List<Expr> arguments) implements Expr {

    public Call {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(callee, "callee");
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitCall(this);
    }

    @Override
    public Call deepCopy() {
        List<Expr> copies = new ArrayList<>(arguments.size());
        for (Expr argument : arguments) {
            copies.add((Expr) argument.deepCopy());
        }
        return new Call(span, callee.deepCopy(), copies);
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 1, Integer.MAX_VALUE);
        return new Call(span, ChildSlots.slot(this, newChildren, 0, Identifier.class),
                ChildSlots.rest(this, newChildren, 1, Expr.class));
    }
}
