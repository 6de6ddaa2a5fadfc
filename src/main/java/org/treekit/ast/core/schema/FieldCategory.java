package org.treekit.ast.core.schema;

/**
 * How a declared field of a node kind participates in the tree.
 */
public enum FieldCategory {
    /** A plain value (number, string, boolean, operator name). Never a child. */
    SCALAR,
    /** A single child node, possibly optional. */
    NODE,
    /** An ordered list of child nodes. */
    NODE_LIST;

    public boolean isChild() {
        return this != SCALAR;
    }
}
