package org.treekit.ast.core;

/**
 * Thrown when a node kind or a visitor breaks the node kernel contract, for example a kind that
 * does not implement {@code equals}, or a node asked to accept a visitor of another grammar.
 * <p>
 * This signals a programming defect and is not meant to be caught.
 */
public class NodeContractException extends IllegalStateException {

    /**
     * Constructs a new contract exception.
     * @param message The detail message.
     */
    public NodeContractException(String message) {
        super(message);
    }
}
