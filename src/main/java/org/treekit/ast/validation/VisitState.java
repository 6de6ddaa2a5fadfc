package org.treekit.ast.validation;

/**
 * Per-node state of a structural validation run.
 */
public enum VisitState {
    /** Not reached yet. */
    UNVISITED,
    /** Entered; its subtree is being walked. */
    IN_PROGRESS,
    /** It and its whole subtree have been walked. */
    DONE
}
