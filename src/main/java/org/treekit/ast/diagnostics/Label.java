package org.treekit.ast.diagnostics;

import org.treekit.ast.api.Span;

import java.util.Objects;

/**
 * A labeled span of a {@link Diagnostic}.
 *
 * @param span    The source span the label points at.
 * @param message The label text.
 * @param primary Whether this is the primary label of the diagnostic.
 */
public record Label(Span span, String message, boolean primary) {

    public Label {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(message, "message");
    }

    public static Label primary(Span span, String message) {
        return new Label(span, message, true);
    }

    public static Label secondary(Span span, String message) {
        return new Label(span, message, false);
    }
}
