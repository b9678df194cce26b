package com.gamezip.cgi;

import com.gamezip.core.http.ResourceLimitExceededException;
import com.gamezip.core.metrics.GameZipMetrics;
import com.gamezip.core.security.PathSecurity;
import com.gamezip.core.security.SecurityViolationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs legacy scripts through an external CGI/1.1 interpreter ({@code php-cgi}).
 *
 * <p>One subprocess per request. The child receives only the CGI environment built
 * by {@link CgiEnvironmentBuilder}; nothing from this JVM's environment is inherited.
 * Failed executions are reported as {@link CgiExecutionException} and must not be
 * retried by callers.
 */
@Service
public class CgiExecutor {

    private static final Logger log = LoggerFactory.getLogger(CgiExecutor.class);

    private final CgiProperties properties;
    private final GameZipMetrics metrics;
    private final CgiEnvironmentBuilder environmentBuilder;
    private final CgiOutputParser outputParser = new CgiOutputParser();
    private final ExecutorService pumps;

    public CgiExecutor(CgiProperties properties, @Autowired(required = false) GameZipMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
        this.environmentBuilder = new CgiEnvironmentBuilder(
                properties.getDocumentRoot(), properties.getServerSoftware());
        this.pumps = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Executes {@code scriptPath} for {@code request}.
     *
     * @param scriptPath absolute path of the script; must lie under the document root
     *                   or the cgi-bin directory
     * @throws ScriptPathException            if the script lies outside both directories
     * @throws ResourceLimitExceededException if the request body or the response is too large
     * @throws CgiExecutionException          if the interpreter fails, is killed or times out
     */
    public CgiResponse execute(Path scriptPath, CgiRequest request) {
        Path script = validateScriptPath(scriptPath);

        if (request.hasBody() && request.body().length > properties.getMaxBodySize()) {
            throw new ResourceLimitExceededException("Request body too large", properties.getMaxBodySize());
        }

        Map<String, String> env = environmentBuilder.build(script, request);

        var builder = new ProcessBuilder(properties.getPhpCgiPath());
        if (script.getParent() != null) {
            builder.directory(script.getParent().toFile());
        }
        builder.environment().clear();
        builder.environment().putAll(env);

        log.debug("Executing CGI script {} {}", request.method(), script.getFileName());
        long start = System.currentTimeMillis();

        CgiProcessHandle handle;
        try {
            handle = CgiProcessHandle.start(builder, request.body(),
                    properties.getMaxResponseSize(), properties.getMaxStderrSize(), pumps);
        } catch (IOException e) {
            log.error("Failed to spawn CGI process {}: {}", properties.getPhpCgiPath(), e.getMessage());
            record("spawn_failure", start);
            throw new CgiExecutionException(CgiExecutionException.Kind.PROCESS_SPAWN_FAILURE,
                    "Failed to spawn CGI process", e);
        }

        CgiProcessHandle.Termination termination;
        try {
            termination = handle.await(properties.getTimeoutMs(), properties.getKillGraceMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.terminate(properties.getKillGraceMs());
            record("interrupted", start);
            throw new CgiExecutionException(CgiExecutionException.Kind.TIMEOUT,
                    "CGI execution interrupted", e);
        }

        String stderr = handle.stderr();
        if (!stderr.isBlank()) {
            log.warn("CGI stderr ({}): {}", script.getFileName(), stderr.strip());
        }

        switch (termination.outcome()) {
            case TIMED_OUT -> {
                record("timeout", start);
                throw new CgiExecutionException(CgiExecutionException.Kind.TIMEOUT,
                        "CGI script execution timed out after " + properties.getTimeoutMs() + "ms");
            }
            case OUTPUT_LIMIT_EXCEEDED -> {
                record("response_too_large", start);
                throw new ResourceLimitExceededException("CGI response too large", properties.getMaxResponseSize());
            }
            default -> {
                // fall through to output handling
            }
        }

        byte[] output = handle.stdout();
        int exitCode = termination.exitCode();
        if (exitCode != 0 && !outputParser.isWellFormed(output)) {
            if (termination.outcome() == CgiProcessHandle.Outcome.SIGNALED) {
                record("signaled", start);
                throw new CgiExecutionException(CgiExecutionException.Kind.SIGNAL_TERMINATION,
                        "CGI process terminated by signal (exit status " + exitCode + ")");
            }
            record("failed", start);
            throw new CgiExecutionException(CgiExecutionException.Kind.ABNORMAL_EXIT,
                    "CGI process exited with code " + exitCode);
        }
        if (exitCode != 0) {
            log.warn("CGI process exited with code {} but produced a response", exitCode);
        }

        CgiResponse response = outputParser.parse(output);
        record("success", start);
        log.info("CGI {} {} -> {} ({} bytes, {}ms)", request.method(), request.path(),
                response.statusCode(), response.body().length, System.currentTimeMillis() - start);
        return response;
    }

    /**
     * Returns {@code true} when the configured interpreter exists and is executable.
     */
    public boolean validateBinary() {
        Path binary = Path.of(properties.getPhpCgiPath());
        boolean usable = Files.isRegularFile(binary) && Files.isExecutable(binary);
        if (!usable) {
            log.warn("php-cgi binary not usable at {}", binary);
        }
        return usable;
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }

    private Path validateScriptPath(Path scriptPath) {
        try {
            return PathSecurity.validatePathInAllowedDirectories(
                    List.of(Path.of(properties.getDocumentRoot()), Path.of(properties.getCgiBinPath())),
                    scriptPath.toAbsolutePath().toString());
        } catch (SecurityViolationException e) {
            log.warn("[Security] Rejected CGI script outside allowed directories");
            throw new ScriptPathException("Script path not in allowed directories");
        }
    }

    private void record(String outcome, long start) {
        if (metrics != null) {
            metrics.recordCgiExecution(outcome, System.currentTimeMillis() - start);
        }
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "cgi-pump-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
