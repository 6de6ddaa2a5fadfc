package org.treekit.ast.validation;

import org.treekit.ast.core.Node;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.diagnostics.DiagnosticsEngine;
import org.treekit.ast.diagnostics.Severity;
import org.treekit.ast.traversal.TreeWalker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs per-node validation over a tree and collects the findings.
 * <p>
 * For every node the {@link Validatable} hook runs first (if the node, or the value it wraps,
 * implements it), followed by the {@link ValidationRule}s registered for the node's exact class.
 * Findings accumulate across calls to {@link #validate(Node)} until {@link #clear()}.
 * <p>
 * This validator walks with a {@link TreeWalker} and is not cycle-safe; see
 * {@link StructuralValidator}.
 */
public class NodeValidator {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final Map<Class<? extends Node>, List<ValidationRule<Node>>> rules = new HashMap<>();

    /**
     * Registers a rule for one node kind.
     * @param kind The exact class of the nodes to check.
     * @param rule The rule.
     * @return This validator.
     */
    public <N extends Node> NodeValidator addRule(Class<N> kind, ValidationRule<? super N> rule) {
        rules.computeIfAbsent(kind, k -> new ArrayList<>()).add(node -> rule.check(kind.cast(node)));
        return this;
    }

    /**
     * Validates the tree rooted at {@code root}.
     * @param root The root node.
     */
    public void validate(Node root) {
        Map<Class<? extends Node>, Consumer<Node>> handlers = new HashMap<>();
        for (Class<? extends Node> kind : rules.keySet()) {
            handlers.put(kind, this::runRules);
        }
        new TreeWalker(handlers, this::runHook).walk(root);
    }

    /**
     * Runs the hook and the rules for a single node.
     * @param node The node.
     */
    protected void check(Node node) {
        runHook(node);
        runRules(node);
    }

    private void runHook(Node node) {
        node.as(Validatable.class).ifPresent(v -> diagnostics.reportAll(v.validate()));
    }

    private void runRules(Node node) {
        for (ValidationRule<Node> rule : rules.getOrDefault(node.getClass(), List.of())) {
            diagnostics.reportAll(rule.check(node));
        }
    }

    /**
     * @return The collector holding this validator's findings.
     */
    protected DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * @return All findings in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }

    /**
     * @return {@code true} if no finding has ERROR severity.
     */
    public boolean isValid() {
        return !diagnostics.hasErrors();
    }

    public List<Diagnostic> errorsOnly() {
        return diagnostics.withSeverity(Severity.ERROR);
    }

    public List<Diagnostic> warningsOnly() {
        return diagnostics.withSeverity(Severity.WARNING);
    }

    public List<Diagnostic> hintsOnly() {
        return diagnostics.withSeverity(Severity.HINT);
    }

    public List<Diagnostic> infoOnly() {
        return diagnostics.withSeverity(Severity.INFO);
    }

    public int count(Severity severity) {
        return diagnostics.count(severity);
    }

    /**
     * @return A one-line summary, see {@link DiagnosticsEngine#summary()}.
     */
    public String summary() {
        return diagnostics.summary();
    }

    /**
     * Discards all findings. Registered rules are kept.
     */
    public void clear() {
        diagnostics.clear();
    }
}
