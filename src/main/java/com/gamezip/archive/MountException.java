package com.gamezip.archive;

/**
 * Thrown when an archive cannot be opened for mounting. Maps to HTTP 500.
 */
public class MountException extends RuntimeException {
    public MountException(String message) {
        super(message);
    }

    public MountException(String message, Throwable cause) {
        super(message, cause);
    }
}
