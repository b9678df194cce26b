package com.gamezip.cgi;

import java.util.Map;

/**
 * One inbound request to be handed to a CGI script.
 *
 * @param method   HTTP method
 * @param hostname archived hostname the request addressed
 * @param port     port from the request URL, or -1 when absent
 * @param path     URL path, starting with a slash
 * @param query    raw query string without the leading '?', empty when absent
 * @param headers  request headers, names as received
 * @param body     request body, or null when there is none
 */
public record CgiRequest(String method, String hostname, int port, String path, String query,
                         Map<String, String> headers, byte[] body) {

    public CgiRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        query = query == null ? "" : query;
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    /** Case-insensitive header lookup. */
    public String header(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
