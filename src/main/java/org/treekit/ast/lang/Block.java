package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.ChildSlots;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.validation.Validatable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of statements.
 */
public record Block(Span span, List<Stmt> statements) implements Stmt, Validatable {

    public Block {
        Objects.requireNonNull(span, "span");
        statements = List.copyOf(statements);
    }

    @Override
    public List<Node> children() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitBlock(this);
    }

    @Override
    public Block deepCopy() {
        List<Stmt> copies = new ArrayList<>(statements.size());
        for (Stmt statement : statements) {
            copies.add((Stmt) statement.deepCopy());
        }
        return new Block(span, copies);
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        return new Block(span, ChildSlots.rest(this, newChildren, 0, Stmt.class));
    }

    @Override
    public List<Diagnostic> validate() {
        if (!statements.isEmpty()) {
            return List.of();
        }
        return List.of(Diagnostic.info("Empty block").primary(span, "here").build());
    }
}
