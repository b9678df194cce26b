package com.gamezip.cgi;

import com.gamezip.core.security.SecurityViolationException;

/**
 * Thrown when a script path lies outside both the document root and the cgi-bin directory.
 */
public class ScriptPathException extends SecurityViolationException {
    public ScriptPathException(String message) {
        super(message);
    }
}
