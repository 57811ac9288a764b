package com.logq.query;

/**
 * A filter, sort or projection document that does not have one of the recognised shapes.
 * Raised before the log is read.
 */
public class InvalidFilterException extends IllegalArgumentException {
    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
