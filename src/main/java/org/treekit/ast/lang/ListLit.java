package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A list literal. Its elements may be any node, including value-type leaves wrapped in a
 * {@link org.treekit.ast.core.repr.ValueNode}.
 */
public record ListLit(Span span, List<Node> elements) implements Expr {

    public ListLit {
        Objects.requireNonNull(span, "span");
        elements = List.copyOf(elements);
    }

    @Override
    public List<Node> children() {
        return elements;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitListLit(this);
    }

    @Override
    public ListLit deepCopy() {
        List<Node> copies = new ArrayList<>(elements.size());
        for (Node element : elements) {
            copies.add(element.deepCopy());
        }
        return new ListLit(span, copies);
    }

    @Override
    public Node withChildren(List<Node> newChildren) {
        return new ListLit(span, newChildren);
    }
}
