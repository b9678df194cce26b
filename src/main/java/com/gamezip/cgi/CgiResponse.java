package com.gamezip.cgi;

import java.util.Map;

/**
 * Parsed output of one CGI execution.
 *
 * @param statusCode HTTP status from the script's {@code Status} header, 200 by default
 * @param headers    response headers with case-insensitive lookup, last duplicate wins
 * @param body       bytes after the header block
 */
public record CgiResponse(int statusCode, Map<String, String> headers, byte[] body) {}
