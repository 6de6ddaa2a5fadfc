package org.treekit.ast.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An engine for collecting and querying diagnostics produced while validating a tree.
 * <p>
 * This decouples the reporting of findings from the decision whether they fail a build.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a single diagnostic.
     * @param diagnostic The diagnostic to record.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Records several diagnostics, keeping their order.
     * @param found The diagnostics to record.
     */
    public void reportAll(Collection<Diagnostic> found) {
        diagnostics.addAll(found);
    }

    /**
     * @return {@code true} if at least one {@link Severity#ERROR} was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @param severity The severity to filter by.
     * @return The diagnostics of the given severity in report order.
     */
    public List<Diagnostic> withSeverity(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    /**
     * @param severity The severity to count.
     * @return The number of diagnostics of that severity.
     */
    public int count(Severity severity) {
        return (int) diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /**
     * Groups the collected diagnostics by severity. Severities without findings are absent.
     * @return The grouped diagnostics, ordered by severity.
     */
    public Map<Severity, List<Diagnostic>> bySeverity() {
        return diagnostics.stream().collect(Collectors.groupingBy(
                Diagnostic::severity, () -> new EnumMap<>(Severity.class), Collectors.toList()));
    }

    /**
     * @return {@code true} if nothing was reported.
     */
    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns a one-line summary such as {@code "Validation failed: 2 errors, 1 warnings"}.
     * Only errors fail validation; findings of lower severity are listed after
     * {@code "Validation passed: "}.
     * @return The summary.
     */
    public String summary() {
        if (diagnostics.isEmpty()) {
            return "Validation passed: no errors found";
        }
        List<String> parts = new ArrayList<>();
        appendCount(parts, Severity.ERROR, "errors");
        appendCount(parts, Severity.WARNING, "warnings");
        appendCount(parts, Severity.HINT, "hints");
        appendCount(parts, Severity.INFO, "info");
        return (hasErrors() ? "Validation failed: " : "Validation passed: ") + String.join(", ", parts);
    }

    private void appendCount(List<String> parts, Severity severity, String noun) {
        int n = count(severity);
        if (n > 0) {
            parts.add(n + " " + noun);
        }
    }
}
