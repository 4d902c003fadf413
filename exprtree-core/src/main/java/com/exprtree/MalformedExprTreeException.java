package com.exprtree;

/**
 * Thrown when an expression tree breaks its structural invariants, e.g. a node
 * attached to a second parent or a tree nested deeper than a walker allows.
 * It signals a bug in the code producing the tree.
 */
public class MalformedExprTreeException extends IllegalStateException {

    public MalformedExprTreeException(String message) {
        super(message);
    }
}
