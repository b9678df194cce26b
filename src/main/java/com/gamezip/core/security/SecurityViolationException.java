package com.gamezip.core.security;

/**
 * Thrown when a path resolves outside the directory it is allowed to live in.
 * Maps to HTTP 403.
 */
public class SecurityViolationException extends RuntimeException {
    public SecurityViolationException(String message) {
        super(message);
    }

    public SecurityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
