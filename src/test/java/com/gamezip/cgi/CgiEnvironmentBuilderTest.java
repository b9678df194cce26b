package com.gamezip.cgi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CgiEnvironmentBuilderTest {

    private static final Path SCRIPT = Path.of("/srv/htdocs/example.com/index.php");

    private final CgiEnvironmentBuilder builder = new CgiEnvironmentBuilder("/srv/htdocs", "gamezip-server/test");

    @Test
    @DisplayName("contains the CGI/1.1 meta-variables for a GET request")
    void getRequest() {
        var request = new CgiRequest("get", "example.com", 8080, "/index.php", "a=1&b=2", Map.of(), null);

        Map<String, String> env = builder.build(SCRIPT, request);

        assertEquals("CGI/1.1", env.get("GATEWAY_INTERFACE"));
        assertEquals("CGI", env.get("REDIRECT_STATUS"));
        assertEquals("HTTP/1.1", env.get("SERVER_PROTOCOL"));
        assertEquals("gamezip-server/test", env.get("SERVER_SOFTWARE"));
        assertEquals("example.com", env.get("SERVER_NAME"));
        assertEquals("8080", env.get("SERVER_PORT"));
        assertEquals("GET", env.get("REQUEST_METHOD"));
        assertEquals("/index.php?a=1&b=2", env.get("REQUEST_URI"));
        assertEquals("/index.php", env.get("SCRIPT_NAME"));
        assertEquals(SCRIPT.toString(), env.get("SCRIPT_FILENAME"));
        assertEquals(SCRIPT.toString(), env.get("PATH_TRANSLATED"));
        assertEquals("a=1&b=2", env.get("QUERY_STRING"));
        assertEquals("/srv/htdocs", env.get("DOCUMENT_ROOT"));
        assertFalse(env.containsKey("CONTENT_LENGTH"));
        assertFalse(env.containsKey("CONTENT_TYPE"));
    }

    @Test
    @DisplayName("missing host and port fall back to localhost:80 and the query to empty")
    void defaults() {
        var request = new CgiRequest("GET", null, -1, "/x.php", null, null, null);

        Map<String, String> env = builder.build(SCRIPT, request);

        assertEquals("localhost", env.get("SERVER_NAME"));
        assertEquals("80", env.get("SERVER_PORT"));
        assertEquals("", env.get("QUERY_STRING"));
        assertEquals("/x.php", env.get("REQUEST_URI"));
    }

    @Test
    @DisplayName("a body adds CONTENT_LENGTH and CONTENT_TYPE")
    void postRequest() {
        byte[] body = "name=value".getBytes(StandardCharsets.UTF_8);
        var request = new CgiRequest("POST", "example.com", -1, "/form.php", "",
                Map.of("Content-Type", "multipart/form-data; boundary=x", "Content-Length", "10"), body);

        Map<String, String> env = builder.build(SCRIPT, request);

        assertEquals("10", env.get("CONTENT_LENGTH"));
        assertEquals("multipart/form-data; boundary=x", env.get("CONTENT_TYPE"));
        assertFalse(env.containsKey("HTTP_CONTENT_TYPE"));
        assertFalse(env.containsKey("HTTP_CONTENT_LENGTH"));
    }

    @Test
    @DisplayName("a body without Content-Type defaults to form encoding")
    void defaultContentType() {
        var request = new CgiRequest("POST", "example.com", -1, "/form.php", "", Map.of(), new byte[]{1});
        assertEquals(CgiEnvironmentBuilder.DEFAULT_CONTENT_TYPE, builder.build(SCRIPT, request).get("CONTENT_TYPE"));
    }

    @Test
    @DisplayName("headers become HTTP_* variables, except Proxy and malformed ones")
    void headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", "Flash Player");
        headers.put("X-Custom-Header", "yes");
        headers.put("Proxy", "http://evil.example:8080");
        headers.put("Bad Header", "x");
        headers.put("X-Nul", "a\0b");
        var request = new CgiRequest("GET", "example.com", -1, "/x.php", "", headers, null);

        Map<String, String> env = builder.build(SCRIPT, request);

        assertEquals("Flash Player", env.get("HTTP_USER_AGENT"));
        assertEquals("yes", env.get("HTTP_X_CUSTOM_HEADER"));
        assertFalse(env.containsKey("HTTP_PROXY"));
        assertFalse(env.containsKey("HTTP_BAD HEADER"));
        assertFalse(env.containsKey("HTTP_X_NUL"));
    }

    @Test
    @DisplayName("the environment holds only CGI meta-variables")
    void onlyCgiVariables() {
        var request = new CgiRequest("GET", "example.com", -1, "/x.php", "", Map.of(), null);

        Map<String, String> env = builder.build(SCRIPT, request);

        assertEquals(Set.of("REDIRECT_STATUS", "GATEWAY_INTERFACE", "SERVER_SOFTWARE", "SERVER_PROTOCOL",
                "SERVER_NAME", "SERVER_PORT", "REQUEST_METHOD", "REQUEST_URI", "SCRIPT_NAME", "SCRIPT_FILENAME",
                "PATH_INFO", "PATH_TRANSLATED", "QUERY_STRING", "DOCUMENT_ROOT", "REMOTE_ADDR", "REMOTE_HOST"),
                env.keySet());
    }

    @Test
    @DisplayName("toCgiName upper-cases and replaces dashes")
    void toCgiName() {
        assertEquals("HTTP_ACCEPT_LANGUAGE", CgiEnvironmentBuilder.toCgiName("accept-language"));
    }
}
