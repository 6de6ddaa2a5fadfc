package org.treekit.ast.lang;

import org.treekit.ast.core.Node;

/**
 * Marker for statement nodes of the reference grammar.
 */
public interface Stmt extends Node {
}
