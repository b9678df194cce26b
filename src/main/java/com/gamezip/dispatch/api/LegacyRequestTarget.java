package com.gamezip.dispatch.api;

import com.gamezip.core.security.InputValidator;

/**
 * The archived host and path a file request addresses.
 *
 * <p>Legacy players reach the server three ways:
 * <ul>
 *   <li>proxy style, with an absolute URI on the request line
 *       ({@code GET http://example.com/game.swf});</li>
 *   <li>path-prefixed, with the absolute URL embedded in the path
 *       ({@code GET /http://example.com/game.swf}), which some containers
 *       collapse to {@code /http:/example.com/game.swf};</li>
 *   <li>a plain path with the archived host in the {@code Host} header.</li>
 * </ul>
 *
 * @param hostname archived hostname, without port
 * @param port     explicit port, or -1
 * @param path     raw (still percent-encoded) path, starting with a slash
 * @param query    raw query string, empty when absent
 */
public record LegacyRequestTarget(String hostname, int port, String path, String query) {

    private static final String[] SCHEMES = {"http:", "https:"};

    public static LegacyRequestTarget parse(String requestUri, String queryString, String hostHeader) {
        String uri = requestUri == null || requestUri.isEmpty() ? "/" : requestUri;
        String query = queryString == null ? "" : queryString;

        String absolute = absoluteForm(uri);
        if (absolute == null) {
            String host = hostHeader == null || hostHeader.isBlank() ? "localhost" : hostHeader.trim();
            return new LegacyRequestTarget(InputValidator.stripPort(host), portOf(host), uri, query);
        }

        // absolute is "<scheme>://<authority><path>[?query]"
        String rest = absolute.substring(absolute.indexOf("//") + 2);
        int q = rest.indexOf('?');
        if (q >= 0) {
            String embedded = rest.substring(q + 1);
            query = query.isEmpty() ? embedded : embedded + "&" + query;
            rest = rest.substring(0, q);
        }
        int slash = rest.indexOf('/');
        String authority = slash >= 0 ? rest.substring(0, slash) : rest;
        String path = slash >= 0 ? rest.substring(slash) : "/";
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        return new LegacyRequestTarget(InputValidator.stripPort(authority), portOf(authority), path, query);
    }

    /** Returns the embedded absolute URL, normalized to {@code scheme://...}, or null. */
    private static String absoluteForm(String uri) {
        String candidate = uri.startsWith("/") ? uri.substring(1) : uri;
        for (String scheme : SCHEMES) {
            if (!candidate.regionMatches(true, 0, scheme, 0, scheme.length())) {
                continue;
            }
            String afterScheme = candidate.substring(scheme.length());
            if (afterScheme.startsWith("//")) {
                return scheme + afterScheme;
            }
            if (afterScheme.startsWith("/") && uri.startsWith("/")) {
                return scheme + "/" + afterScheme;
            }
        }
        return null;
    }

    private static int portOf(String authority) {
        if (authority.startsWith("[")) {
            return -1;
        }
        int colon = authority.indexOf(':');
        if (colon < 0 || colon == authority.length() - 1) {
            return -1;
        }
        try {
            return Integer.parseInt(authority.substring(colon + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
