package com.gamezip.core.security;

import java.util.regex.Pattern;

/**
 * Boundary validation for identifiers that arrive over HTTP.
 *
 * <p>Every mount id, hostname and file path passes through here before it
 * reaches {@link com.gamezip.archive.ZipManager} or
 * {@link com.gamezip.cgi.CgiExecutor}.
 */
public final class InputValidator {

    static final int MAX_GAME_ID_LENGTH = 255;
    static final int MAX_HOSTNAME_LENGTH = 253;
    static final int MAX_FILE_PATH_LENGTH = 2048;

    private static final Pattern GAME_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    /** Single alphanumeric, or alphanumeric at both ends with alnum/-/_/. in between. */
    private static final Pattern HOSTNAME = Pattern.compile(
            "^[a-zA-Z0-9](?:[a-zA-Z0-9\\-_.]*[a-zA-Z0-9])?$"
    );

    private static final Pattern ENCODED_TRAVERSAL = Pattern.compile(
            "\\.\\.%(?:2[fF]|5[cC])|%2[eE]%2[eE]%(?:2[fF]|5[cC])"
    );

    private InputValidator() {}

    public static String validateGameId(String gameId) {
        if (gameId == null || gameId.isEmpty()) {
            throw new InputValidationException("Invalid game ID: Game ID is required");
        }
        if (gameId.length() > MAX_GAME_ID_LENGTH) {
            throw new InputValidationException("Invalid game ID: Game ID is too long");
        }
        if (!GAME_ID.matcher(gameId).matches()) {
            throw new InputValidationException("Invalid game ID: Game ID contains invalid characters");
        }
        return gameId;
    }

    public static String validateHostname(String hostname) {
        if (hostname == null || hostname.isEmpty()) {
            throw new InputValidationException("Invalid hostname: Hostname is required");
        }
        if (hostname.length() > MAX_HOSTNAME_LENGTH) {
            throw new InputValidationException("Invalid hostname: Hostname is too long");
        }
        if (!HOSTNAME.matcher(hostname).matches()) {
            throw new InputValidationException("Invalid hostname: Invalid hostname format");
        }
        return hostname;
    }

    public static String validateFilePath(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            throw new InputValidationException("Invalid file path: Path is required");
        }
        if (filePath.length() > MAX_FILE_PATH_LENGTH) {
            throw new InputValidationException("Invalid file path: Path is too long");
        }
        if (filePath.indexOf('\0') >= 0) {
            throw new InputValidationException("Invalid file path: Path contains null bytes");
        }
        if (filePath.indexOf('\\') >= 0) {
            throw new InputValidationException("Invalid file path: Path contains backslashes (use forward slashes)");
        }
        if (ENCODED_TRAVERSAL.matcher(filePath).find()) {
            throw new InputValidationException("Invalid file path: Path contains URL-encoded directory traversal");
        }
        return filePath;
    }

    /**
     * Strips an optional {@code :port} suffix from a Host header value.
     * Bracketed IPv6 literals are returned unchanged and fail hostname validation.
     */
    public static String stripPort(String host) {
        if (host == null || host.startsWith("[")) {
            return host;
        }
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }
}
