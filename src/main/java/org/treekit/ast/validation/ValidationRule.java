package org.treekit.ast.validation;

import org.treekit.ast.core.Node;
import org.treekit.ast.diagnostics.Diagnostic;

import java.util.List;

/**
 * An external check registered on a {@link NodeValidator} for one node kind.
 *
 * @param <N> The node kind the rule inspects.
 */
@FunctionalInterface
public interface ValidationRule<N extends Node> {

    /**
     * @param node The node to check.
     * @return The findings, never {@code null}.
     */
    List<Diagnostic> check(N node);
}
