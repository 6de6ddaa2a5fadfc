package org.treekit.ast.validation;

import org.treekit.ast.diagnostics.Diagnostic;

import java.util.List;

/**
 * Optional per-node validation hook. Node kinds (and value leaves) that can check their own
 * fields implement it; validators call it once per visited node.
 */
public interface Validatable {

    /**
     * @return The findings for this node alone, never {@code null}; empty if the node is valid.
     */
    List<Diagnostic> validate();
}
