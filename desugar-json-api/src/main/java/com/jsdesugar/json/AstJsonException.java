package com.jsdesugar.json;

/**
 * Exception thrown when a tree cannot be written as JSON or options cannot be read from it.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
