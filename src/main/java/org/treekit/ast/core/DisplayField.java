package org.treekit.ast.core;

/**
 * Capability of a node kind that has one obvious scalar to show in a one-line rendering, such as
 * the value of a literal or the name of an identifier.
 */
public interface DisplayField {

    /**
     * @return The display text of this node's main scalar.
     */
    String displayValue();
}
