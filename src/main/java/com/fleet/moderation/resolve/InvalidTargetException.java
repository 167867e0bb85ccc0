package com.fleet.moderation.resolve;

/**
 * Thrown when a target argument is malformed. Raised before any remote call is made.
 */
public class InvalidTargetException extends RuntimeException {

    public InvalidTargetException(String message) {
        super(message);
    }

    public InvalidTargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
