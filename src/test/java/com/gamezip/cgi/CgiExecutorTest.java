package com.gamezip.cgi;

import com.gamezip.core.http.ResourceLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs real subprocesses: each test installs a small shell script as the CGI
 * interpreter and lets the executor drive it.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class CgiExecutorTest {

    @TempDir
    Path tmp;

    private Path htdocs;
    private Path cgiBin;
    private Path script;
    private CgiProperties properties;
    private CgiExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        htdocs = Files.createDirectories(tmp.resolve("htdocs"));
        cgiBin = Files.createDirectories(tmp.resolve("cgi-bin"));
        script = Files.writeString(Files.createDirectories(htdocs.resolve("example.com")).resolve("index.php"),
                "<?php echo 'hi'; ?>");

        properties = new CgiProperties();
        properties.setEnabled(true);
        properties.setDocumentRoot(htdocs.toString());
        properties.setCgiBinPath(cgiBin.toString());
        properties.setTimeoutMs(5_000);
        properties.setKillGraceMs(1_000);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /** Installs {@code body} as the interpreter and builds the executor around it. */
    private void interpreter(String body) throws IOException {
        Path binary = tmp.resolve("php-cgi");
        Files.writeString(binary, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(binary, PosixFilePermissions.fromString("rwxr-xr-x"));
        properties.setPhpCgiPath(binary.toString());
        executor = new CgiExecutor(properties, null);
    }

    private static CgiRequest get(String path) {
        return new CgiRequest("GET", "example.com", -1, path, "", Map.of("X-Custom", "1"), null);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("successful execution")
    class Success {

        @Test
        @DisplayName("a Status header becomes the response status")
        void statusFromScript() throws Exception {
            interpreter("printf 'Status: 404 Not Found\\r\\n\\r\\nbody'");

            CgiResponse response = executor.execute(script, get("/index.php"));

            assertEquals(404, response.statusCode());
            assertEquals("body", text(response.body()));
        }

        @Test
        @DisplayName("the request body arrives on stdin")
        void bodyOnStdin() throws Exception {
            interpreter("printf 'Content-Type: text/plain\\n\\n'\nprintf '%s|' \"$CONTENT_LENGTH\"\n/bin/cat");
            byte[] body = "name=flash&level=3".getBytes(StandardCharsets.UTF_8);
            var request = new CgiRequest("POST", "example.com", -1, "/index.php", "", Map.of(), body);

            CgiResponse response = executor.execute(script, request);

            assertEquals("text/plain", response.headers().get("Content-Type"));
            assertEquals(body.length + "|name=flash&level=3", text(response.body()));
        }

        @Test
        @DisplayName("output without headers is served as HTML")
        void headerlessOutput() throws Exception {
            interpreter("printf '<b>legacy</b>'");

            CgiResponse response = executor.execute(script, get("/index.php"));

            assertEquals(200, response.statusCode());
            assertEquals("text/html", response.headers().get("Content-Type"));
            assertEquals("<b>legacy</b>", text(response.body()));
        }

        @Test
        @DisplayName("the interpreter sees CGI variables but none of the server's environment")
        void environmentIsNotInherited() throws Exception {
            assumeTrue(System.getenv("HOME") != null, "needs HOME in the test environment");
            interpreter("printf 'Content-Type: text/plain\\n\\n'\nexport -p");

            String env = text(executor.execute(script, get("/index.php")).body());

            assertTrue(env.contains("REQUEST_METHOD="), env);
            assertTrue(env.contains("HTTP_X_CUSTOM="), env);
            assertTrue(env.contains("SCRIPT_FILENAME="), env);
            assertFalse(Pattern.compile("(?m)^(export|declare -x) HOME=").matcher(env).find(), env);
        }

        @Test
        @DisplayName("a non-zero exit with a complete response is still served")
        void nonZeroExitWithResponse() throws Exception {
            interpreter("printf 'Status: 500 Internal Server Error\\n\\nerror page'\nexit 255");

            CgiResponse response = executor.execute(script, get("/index.php"));

            assertEquals(500, response.statusCode());
            assertEquals("error page", text(response.body()));
        }

        @Test
        @DisplayName("scripts under cgi-bin are allowed")
        void cgiBinScript() throws Exception {
            interpreter("printf 'Content-Type: text/plain\\n\\nok'");
            Path perl = Files.writeString(cgiBin.resolve("counter.pl"), "print 1;");

            assertEquals("ok", text(executor.execute(perl, get("/counter.pl")).body()));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a script that never terminates times out and is signalled")
        void timeout() throws Exception {
            Path marker = tmp.resolve("terminated");
            interpreter("trap 'echo got > \"" + marker + "\"; exit 143' TERM\nwhile :; do :; done");
            properties.setTimeoutMs(500);
            executor = new CgiExecutor(properties, null);

            long start = System.nanoTime();
            var e = assertThrows(CgiExecutionException.class, () -> executor.execute(script, get("/index.php")));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(CgiExecutionException.Kind.TIMEOUT, e.kind());
            assertTrue(elapsedMs < 500 + 3_000, "took " + elapsedMs + "ms");

            long deadline = System.currentTimeMillis() + 5_000;
            while (!Files.exists(marker) && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            assertTrue(Files.exists(marker), "interpreter never received SIGTERM");
        }

        @Test
        @DisplayName("a missing interpreter is a spawn failure")
        void spawnFailure() {
            properties.setPhpCgiPath(tmp.resolve("no-such-php-cgi").toString());
            executor = new CgiExecutor(properties, null);

            var e = assertThrows(CgiExecutionException.class, () -> executor.execute(script, get("/index.php")));
            assertEquals(CgiExecutionException.Kind.PROCESS_SPAWN_FAILURE, e.kind());
        }

        @Test
        @DisplayName("death by signal without a response is a signal termination")
        void signalTermination() throws Exception {
            interpreter("kill -9 $$");

            var e = assertThrows(CgiExecutionException.class, () -> executor.execute(script, get("/index.php")));
            assertEquals(CgiExecutionException.Kind.SIGNAL_TERMINATION, e.kind());
        }

        @Test
        @DisplayName("a non-zero exit without a response is an abnormal exit")
        void abnormalExit() throws Exception {
            interpreter("printf 'PHP Fatal error'\nexit 3");

            var e = assertThrows(CgiExecutionException.class, () -> executor.execute(script, get("/index.php")));
            assertEquals(CgiExecutionException.Kind.ABNORMAL_EXIT, e.kind());
        }

        @Test
        @DisplayName("output past the response limit is refused")
        void responseTooLarge() throws Exception {
            interpreter("printf 'Content-Type: text/plain\\n\\n'\nwhile :; do printf '0123456789'; done");
            properties.setMaxResponseSize(1_000);
            executor = new CgiExecutor(properties, null);

            assertThrows(ResourceLimitExceededException.class, () -> executor.execute(script, get("/index.php")));
        }

        @Test
        @DisplayName("a body past the request limit is refused before spawning")
        void bodyTooLarge() throws Exception {
            Path spawned = tmp.resolve("spawned");
            interpreter("echo x > \"" + spawned + "\"");
            properties.setMaxBodySize(4);
            executor = new CgiExecutor(properties, null);
            var request = new CgiRequest("POST", "example.com", -1, "/index.php", "", Map.of(), new byte[5]);

            assertThrows(ResourceLimitExceededException.class, () -> executor.execute(script, request));
            assertFalse(Files.exists(spawned));
        }

        @Test
        @DisplayName("scripts outside the document root and cgi-bin are rejected")
        void scriptOutsideAllowedDirectories() throws Exception {
            interpreter("printf 'Content-Type: text/plain\\n\\nran'");
            Path outside = Files.writeString(tmp.resolve("evil.php"), "<?php ?>");

            assertThrows(ScriptPathException.class, () -> executor.execute(outside, get("/evil.php")));
            assertThrows(ScriptPathException.class,
                    () -> executor.execute(htdocs.resolve("../evil.php"), get("/evil.php")));
        }
    }

    @Test
    @DisplayName("validateBinary checks that the interpreter exists and is executable")
    void validateBinary() throws Exception {
        interpreter("exit 0");
        assertTrue(executor.validateBinary());

        properties.setPhpCgiPath(tmp.resolve("missing").toString());
        assertFalse(executor.validateBinary());
    }
}
