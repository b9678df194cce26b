package com.gamezip.dispatch.api;

import com.gamezip.cgi.CgiExecutionException;
import com.gamezip.core.http.ResourceLimitExceededException;
import com.gamezip.core.security.InputValidationException;
import com.gamezip.core.security.PathSecurity;
import com.gamezip.core.security.SecurityViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Plaintext error responses shared by the gateway controllers. Messages are
 * stripped of filesystem paths before they leave the process.
 */
final class ErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private ErrorResponses() {}

    static ResponseEntity<String> plain(HttpStatus status, String message) {
        log.warn("Sending error {}: {}", status.value(), message);
        var builder = ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN);
        if (status == HttpStatus.PAYLOAD_TOO_LARGE) {
            // the rest of an oversized body is never read
            builder.header(HttpHeaders.CONNECTION, "close");
        }
        return builder.body(PathSecurity.sanitizeErrorMessage(message));
    }

    static ResponseEntity<String> from(RuntimeException e) {
        return plain(statusFor(e), e.getMessage());
    }

    /** Mount failures, CGI failures and anything unexpected map to 500. */
    static HttpStatus statusFor(RuntimeException e) {
        if (e instanceof InputValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof SecurityViolationException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof ResourceLimitExceededException) {
            return HttpStatus.PAYLOAD_TOO_LARGE;
        }
        if (e instanceof CgiExecutionException cgi && cgi.kind() == CgiExecutionException.Kind.TIMEOUT) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
