package org.treekit.ast.lang;

import org.treekit.ast.core.Node;

/**
 * Marker for nodes of the reference grammar that produce a value.
 */
public interface Expr extends Node {
}
