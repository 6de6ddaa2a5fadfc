package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A conditional statement.
 *
 * @param span       The source location.
 * @param condition  The condition.
 * @param thenBranch Executed when the condition holds.
 * @param elseBranch Executed otherwise; {@code null} if absent.
 */
public record IfStmt(Span span, Expr condition, Block thenBranch, Block elseBranch) implements Stmt {

    public IfStmt {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBranch, "thenBranch");
    }

    @Override
    public List<Node> children() {
        return elseBranch == null ? List.of(condition, thenBranch) : List.of(condition, thenBranch, elseBranch);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitIfStmt(this);
    }

    @Override
    public IfStmt deepCopy() {
        return new IfStmt(span, (Expr) condition.deepCopy(), thenBranch.deepCopy(),
                elseBranch == null ? null : elseBranch.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 2, 3);
        return new IfStmt(span,
                ChildSlots.slot(this, newChildren, 0, Expr.class),
                ChildSlots.slot(this, newChildren, 1, Block.class),
                newChildren.size() == 3 ? ChildSlots.slot(this, newChildren, 2, Block.class) : null);
    }
}
