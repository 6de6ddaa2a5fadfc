package org.treekit.ast.diagnostics;

/**
 * The severity of a {@link Diagnostic}. By convention only {@link #ERROR} fails a build.
 */
public enum Severity {
    /** A finding that makes the tree unusable for later passes. */
    ERROR("error"),
    /** A suspicious construct that does not prevent further processing. */
    WARNING("warning"),
    /** A suggestion for improvement. */
    HINT("hint"),
    /** An informational message. */
    INFO("info");

    private final String display;

    Severity(String display) {
        this.display = display;
    }

    /**
     * @return The lower-case name used in rendered output.
     */
    public String display() {
        return display;
    }
}
