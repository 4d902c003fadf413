package com.exprtree.json;

/**
 * Exception thrown when JSON serialization or deserialization of an expression tree fails.
 */
public class ExprJsonException extends RuntimeException {

    public ExprJsonException(String message) {
        super(message);
    }

    public ExprJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
