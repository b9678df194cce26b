package com.gamezip.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Guards the filesystem against traversal through request paths and mount sources.
 */
public final class PathSecurity {

    private static final Logger log = LoggerFactory.getLogger(PathSecurity.class);

    /** %252e, %252f, %255c and %2500 decode to an encoded dot, slash, backslash or NUL. */
    private static final Pattern DOUBLE_ENCODED = Pattern.compile("%25(?:2[eEfF]|5[cC]|00)");

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\.\\.\\\\"),
            Pattern.compile("\\.\\.%2[fF]"),
            Pattern.compile("\\.\\.%5[cC]"),
            Pattern.compile("%2[eE]%2[eE]%(?:2[fF]|5[cC])"),
            Pattern.compile("%00")
    );

    private static final Pattern WINDOWS_PATH = Pattern.compile("[A-Za-z]:\\\\[^:\\s'\"]+");
    private static final Pattern UNIX_PATH = Pattern.compile(
            "/(?:home|data|usr|var|tmp|opt|etc|root|srv|mnt)[^\\s'\"]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NETWORK_PATH = Pattern.compile("\\\\\\\\[^\\s'\"]+");

    private PathSecurity() {}

    public static boolean hasDoubleEncoding(String urlPath) {
        return DOUBLE_ENCODED.matcher(urlPath).find();
    }

    /**
     * Rejects NUL bytes, backslashes, encoded traversal and double encoding.
     * Plain {@code ..} segments are left for {@link #normalizeRelative} to resolve.
     *
     * @return the path unchanged when it is acceptable
     */
    public static String sanitizeUrlPath(String urlPath) {
        if (urlPath == null) {
            throw new InputValidationException("Invalid path: Path is required");
        }
        if (urlPath.indexOf('\0') >= 0) {
            log.warn("[Security] Null byte detected in URL path");
            throw new InputValidationException("Invalid path: Null byte detected");
        }
        if (hasDoubleEncoding(urlPath)) {
            log.warn("[Security] Double-encoded path detected");
            throw new InputValidationException("Invalid path: Double encoding detected");
        }
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(urlPath).find()) {
                log.warn("[Security] Dangerous pattern detected in URL path");
                throw new InputValidationException("Invalid path: Dangerous pattern detected");
            }
        }
        if (urlPath.indexOf('\\') >= 0) {
            log.warn("[Security] Backslash detected in URL path");
            throw new InputValidationException("Invalid path: Backslash detected");
        }

        String decoded = decodePath(urlPath);
        if (decoded.indexOf('\0') >= 0) {
            log.warn("[Security] Encoded null byte detected in URL path");
            throw new InputValidationException("Invalid path: Null byte detected");
        }
        if (countParentSegments(decoded) > countParentSegments(urlPath)) {
            log.warn("[Security] Partially encoded traversal detected in URL path");
            throw new InputValidationException("Invalid path: Dangerous pattern detected");
        }
        return urlPath;
    }

    /**
     * Percent-decodes a URL path once. {@code +} stays a literal plus.
     *
     * @throws InputValidationException on malformed escapes
     */
    public static String decodePath(String urlPath) {
        try {
            return URLDecoder.decode(urlPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("[Security] Malformed URL encoding detected");
            throw new InputValidationException("Invalid path: Malformed URL encoding", e);
        }
    }

    private static int countParentSegments(String path) {
        int count = 0;
        for (String segment : path.split("[/\\\\]", -1)) {
            if ("..".equals(segment)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Resolves {@code requestPath} against {@code basePath} and verifies the result
     * stays inside the base directory.
     *
     * @return the absolute, normalized path
     * @throws SecurityViolationException if the path escapes the base
     */
    public static Path sanitizeAndValidatePath(Path basePath, String requestPath) {
        Path resolvedBase = basePath.toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = resolvedBase.resolve(requestPath).normalize();
        } catch (InvalidPathException e) {
            throw new SecurityViolationException("Invalid path: Directory traversal detected", e);
        }
        if (!resolved.startsWith(resolvedBase)) {
            log.warn("[Security] Path traversal attempt blocked: {}", requestPath);
            throw new SecurityViolationException("Invalid path: Directory traversal detected");
        }
        return resolved;
    }

    /**
     * Tries each allowed base in order and returns the first resolution that stays inside it.
     */
    public static Path validatePathInAllowedDirectories(List<Path> allowedBases, String requestPath) {
        for (Path base : allowedBases) {
            try {
                return sanitizeAndValidatePath(base, requestPath);
            } catch (SecurityViolationException e) {
                log.debug("[Security] {} not inside {}", requestPath, base);
            }
        }
        log.warn("[Security] Path not in any allowed directory: {}", requestPath);
        throw new SecurityViolationException("Invalid path: Not in any allowed directory");
    }

    /**
     * Resolves a mount source and confirms it lives under {@code root}, following
     * symlinks when the file exists. A missing file is checked lexically only so the
     * caller can report it as a mount failure.
     */
    public static Path resolveInsideRoot(Path root, String candidate) {
        Path lexicalRoot = root.toAbsolutePath().normalize();
        Path lexical;
        try {
            lexical = Path.of(candidate).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new InputValidationException("Invalid ZIP path", e);
        }
        if (!lexical.startsWith(lexicalRoot)) {
            log.warn("[Security] ZIP path outside allowed directory: {}", candidate);
            throw new SecurityViolationException("Forbidden: ZIP file must be within games directory");
        }
        if (!Files.exists(lexical)) {
            return lexical;
        }
        try {
            Path realRoot = Files.exists(lexicalRoot) ? lexicalRoot.toRealPath() : lexicalRoot;
            Path real = lexical.toRealPath();
            if (!real.startsWith(realRoot)) {
                log.warn("[Security] ZIP path escapes games directory via symlink: {}", candidate);
                throw new SecurityViolationException("Forbidden: ZIP file must be within games directory");
            }
            return real;
        } catch (IOException e) {
            throw new InputValidationException("Invalid ZIP path", e);
        }
    }

    /**
     * Collapses {@code .} and {@code ..} segments and duplicate slashes of a
     * forward-slash path. Returns the path without a leading slash.
     *
     * @throws InputValidationException if {@code ..} climbs above the root
     */
    public static String normalizeRelative(String path) {
        var segments = new ArrayDeque<String>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new InputValidationException("Invalid path: Directory traversal detected");
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Redacts absolute filesystem paths from a message before it is sent to a client.
     */
    public static String sanitizeErrorMessage(String message) {
        if (message == null) {
            return "";
        }
        String sanitized = WINDOWS_PATH.matcher(message).replaceAll("[path]");
        sanitized = UNIX_PATH.matcher(sanitized).replaceAll("[path]");
        return NETWORK_PATH.matcher(sanitized).replaceAll("[path]");
    }
}
