package com.gamezip.core.http;

/**
 * Thrown when a request body, CGI response or archive entry is larger than its
 * configured cap. Maps to HTTP 413.
 */
public class ResourceLimitExceededException extends RuntimeException {

    private final long limit;

    public ResourceLimitExceededException(String message, long limit) {
        super(message);
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }
}
