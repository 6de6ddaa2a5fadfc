package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.DisplayField;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.validation.Validatable;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A reference to a named variable or function.
 */
public record Identifier(Span span, String name) implements Expr, DisplayField, Validatable {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Identifier {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitIdentifier(this);
    }

    @Override
    public Identifier deepCopy() {
        return new Identifier(span, name);
    }

    @Override
    public String displayValue() {
        return name;
    }

    @Override
    public List<Diagnostic> validate() {
        if (VALID_NAME.matcher(name).matches()) {
            return List.of();
        }
        return List.of(Diagnostic.error("Invalid identifier '" + name + "'")
                .primary(span, "here")
                .help("identifiers start with a letter or '_' followed by letters, digits or '_'")
                .build());
    }
}
