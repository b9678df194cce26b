package com.gamezip.cgi;

/**
 * Thrown when a CGI subprocess could not produce a response.
 *
 * <p>Callers must not retry: scripts may already have had side effects.
 */
public class CgiExecutionException extends RuntimeException {

    public enum Kind {
        /** The interpreter could not be started. */
        PROCESS_SPAWN_FAILURE,
        /** The interpreter was killed by a signal before writing a response. */
        SIGNAL_TERMINATION,
        /** The wall-clock deadline passed; partial output was discarded. */
        TIMEOUT,
        /** Non-zero exit without a well-formed response. */
        ABNORMAL_EXIT
    }

    private final Kind kind;

    public CgiExecutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CgiExecutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
