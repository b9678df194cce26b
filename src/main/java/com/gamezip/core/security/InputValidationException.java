package com.gamezip.core.security;

/**
 * Thrown when an externally supplied identifier (mount id, hostname, URL path)
 * fails validation. Maps to HTTP 400.
 */
public class InputValidationException extends RuntimeException {
    public InputValidationException(String message) {
        super(message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
