package org.treekit.ast.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treekit.ast.core.Node;
import org.treekit.ast.diagnostics.Diagnostic;
import org.treekit.ast.diagnostics.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Facade combining per-node validation and cycle detection in one call.
 */
public class FullValidator {

    private static final Logger LOG = LoggerFactory.getLogger(FullValidator.class);

    private final StructuralValidator validator;

    public FullValidator() {
        this(new StructuralValidator());
    }

    public FullValidator(StructuralValidator validator) {
        this.validator = validator;
    }

    /**
     * Registers a rule on the underlying validator.
     * @see NodeValidator#addRule(Class, ValidationRule)
     */
    public <N extends Node> FullValidator addRule(Class<N> kind, ValidationRule<? super N> rule) {
        validator.addRule(kind, rule);
        return this;
    }

    /**
     * Validates {@code root}, discarding the results of any previous call.
     * @param root The root node.
     * @return Custom findings followed by cycle findings.
     */
    public List<Diagnostic> validate(Node root) {
        validator.clear();
        validator.validate(root);
        LOG.debug("{}", validator.summary());
        return validator.allDiagnostics();
    }

    /**
     * @return {@code true} if the last run found no ERROR.
     */
    public boolean isValid() {
        return validator.isValid();
    }

    /**
     * @return The findings of the last run grouped by severity; severities without findings are absent.
     */
    public Map<Severity, List<Diagnostic>> bySeverity() {
        Map<Severity, List<Diagnostic>> grouped = new EnumMap<>(Severity.class);
        for (Diagnostic d : validator.allDiagnostics()) {
            grouped.computeIfAbsent(d.severity(), s -> new ArrayList<>()).add(d);
        }
        return grouped;
    }

    public String summary() {
        return validator.summary();
    }

    public StructuralValidator structuralValidator() {
        return validator;
    }

    public void clear() {
        validator.clear();
    }
}
