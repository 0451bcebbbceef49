package com.treewalk.json;

/**
 * Thrown when a node tree cannot be written as JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
