package org.treekit.ast.diagnostics;

import org.treekit.ast.api.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A severity-tagged validation finding with one or more labeled source spans.
 * Instances are immutable and created through {@link Builder}:
 * <pre>{@code
 * Diagnostic d = Diagnostic.error("Value must be positive")
 *         .primary(node.span(), "here")
 *         .help("use an unsigned literal")
 *         .build();
 * }</pre>
 *
 * @param severity The severity.
 * @param message  The primary message.
 * @param labels   The labeled spans; at most one of them is primary.
 * @param help     Optional help text, {@code null} when absent.
 * @param notes    Additional notes.
 */
public record Diagnostic(
        Severity severity,
        String message,
        List<Label> labels,
        String help,
        List<String> notes
) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public static Builder error(String message) {
        return new Builder(Severity.ERROR, message);
    }

    public static Builder warning(String message) {
        return new Builder(Severity.WARNING, message);
    }

    public static Builder hint(String message) {
        return new Builder(Severity.HINT, message);
    }

    public static Builder info(String message) {
        return new Builder(Severity.INFO, message);
    }

    /**
     * @return The span of the primary label, if there is one.
     */
    public Optional<Span> primarySpan() {
        return labels.stream().filter(Label::primary).map(Label::span).findFirst();
    }

    /**
     * @return The help text, if any.
     */
    public Optional<String> helpText() {
        return Optional.ofNullable(help);
    }

    /**
     * @return The secondary labels in the order they were added.
     */
    public List<Label> secondaryLabels() {
        return labels.stream().filter(l -> !l.primary()).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.display()).append(": ").append(message);
        primarySpan().ifPresent(span -> sb.append(" at ").append(span));
        return sb.toString();
    }

    /**
     * Accumulates the parts of a diagnostic.
     */
    public static final class Builder {
        private final Severity severity;
        private final String message;
        private final List<Label> labels = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private String help;

        private Builder(Severity severity, String message) {
            this.severity = severity;
            this.message = message;
        }

        /**
         * Sets the primary label. A second call replaces the previous primary label.
         */
        public Builder primary(Span span, String labelMessage) {
            labels.removeIf(Label::primary);
            labels.add(0, Label.primary(span, labelMessage));
            return this;
        }

        public Builder secondary(Span span, String labelMessage) {
            labels.add(Label.secondary(span, labelMessage));
            return this;
        }

        public Builder help(String text) {
            this.help = text;
            return this;
        }

        public Builder note(String text) {
            notes.add(text);
            return this;
        }

        public Diagnostic build() {
            return new Diagnostic(severity, message, labels, help, notes);
        }
    }
}
