package com.gamezip.cgi;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the CGI/1.1 (RFC 3875) environment for one script invocation.
 *
 * <p>This is a pure function of the request and configuration. The result is the
 * complete environment of the child process: nothing from the server's own
 * environment is added to it.
 */
public class CgiEnvironmentBuilder {

    static final String DEFAULT_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private static final Pattern HEADER_NAME = Pattern.compile("^[A-Za-z0-9-]+$");

    /** Content headers travel as CONTENT_*; Proxy would become HTTP_PROXY (httpoxy). */
    private static final Set<String> SKIPPED_HEADERS = Set.of("content-type", "content-length", "proxy");

    private final String documentRoot;
    private final String serverSoftware;

    public CgiEnvironmentBuilder(String documentRoot, String serverSoftware) {
        this.documentRoot = documentRoot;
        this.serverSoftware = serverSoftware;
    }

    public Map<String, String> build(Path scriptPath, CgiRequest request) {
        String script = scriptPath.toString();
        String hostname = request.hostname() == null || request.hostname().isEmpty()
                ? "localhost" : request.hostname();
        String query = request.query();

        var env = new LinkedHashMap<String, String>();
        // php-cgi refuses to run without REDIRECT_STATUS (force-cgi-redirect)
        env.put("REDIRECT_STATUS", "CGI");
        env.put("GATEWAY_INTERFACE", "CGI/1.1");
        env.put("SERVER_SOFTWARE", serverSoftware);
        env.put("SERVER_PROTOCOL", "HTTP/1.1");
        env.put("SERVER_NAME", hostname);
        env.put("SERVER_PORT", request.port() > 0 ? String.valueOf(request.port()) : "80");
        env.put("REQUEST_METHOD", request.method().toUpperCase(Locale.ROOT));
        env.put("REQUEST_URI", query.isEmpty() ? request.path() : request.path() + "?" + query);
        env.put("SCRIPT_NAME", request.path());
        env.put("SCRIPT_FILENAME", script);
        env.put("PATH_INFO", "");
        env.put("PATH_TRANSLATED", script);
        env.put("QUERY_STRING", query);
        env.put("DOCUMENT_ROOT", documentRoot);
        env.put("REMOTE_ADDR", "127.0.0.1");
        env.put("REMOTE_HOST", "localhost");

        if (request.hasBody()) {
            env.put("CONTENT_LENGTH", String.valueOf(request.body().length));
            String contentType = request.header("content-type");
            env.put("CONTENT_TYPE", contentType != null ? contentType : DEFAULT_CONTENT_TYPE);
        }

        for (var header : request.headers().entrySet()) {
            String name = header.getKey();
            String value = header.getValue();
            if (SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))
                    || !HEADER_NAME.matcher(name).matches()
                    || value.indexOf('\0') >= 0) {
                continue;
            }
            env.put(toCgiName(name), value);
        }
        return env;
    }

    /** X-Custom-Header becomes HTTP_X_CUSTOM_HEADER. */
    static String toCgiName(String headerName) {
        return "HTTP_" + headerName.toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
