package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.validation.Validatable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A variable declaration with an optional initializer.
 *
 * @param span  The source location.
 * @param name  The declared name.
 * @param value The initializer, or {@code null} if there is none.
 */
public record VarDecl(Span span, String name, Expr value) implements Stmt, Validatable {

    public VarDecl {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(name, "name");
    }

    public Optional<Expr> initializer() {
        return Optional.ofNullable(value);
    }

    @Override
    public List<Node> children() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitVarDecl(this);
    }

    @Override
    public VarDecl deepCopy() {
        return new VarDecl(span, name, value == null ? null : (Expr) value.deepCopy());
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        ChildSlots.requireSize(this, newChildren, 0, 1);
        return new VarDecl(span, name, newChildren.isEmpty() ? null : ChildSlots.slot(this, newChildren, 0, Expr.class));
    }

    @Override
    public List<Diagnostic> validate() {
        if (value != null) {
            return List.of();
        }
        return List.of(Diagnostic.hint("Variable '" + name + "' is declared without an initializer")
                .primary(span, "here")
                .build());
    }
}
