package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Node;

/**
 * Thrown when a shape conversion is given a node kind outside its domain.
 * This is a programming error, not a user-facing failure.
 */
public class UnsupportedNodeKindException extends IllegalArgumentException {

    private final transient Node node;

    public UnsupportedNodeKindException(String operation, Node node) {
        super("Unsupported node type " + node.getClass().getSimpleName() + " for " + operation);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
