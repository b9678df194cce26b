package com.gamezip.cgi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single CGI child process with bounded output capture and a wall-clock deadline.
 *
 * <p>stdin, stdout and stderr are serviced on pump threads so a script that never
 * reads its input, or floods its output, cannot stall the calling thread past
 * the deadline. Handles are used once and never pooled.
 */
final class CgiProcessHandle {

    private static final Logger log = LoggerFactory.getLogger(CgiProcessHandle.class);

    /** POSIX reports death-by-signal N as exit status 128 + N. */
    private static final int SIGNAL_EXIT_BASE = 128;

    enum Outcome { EXITED, SIGNALED, TIMED_OUT, OUTPUT_LIMIT_EXCEEDED }

    record Termination(Outcome outcome, int exitCode) {}

    private final Process process;
    private final long maxStdout;
    private final AtomicBoolean stdoutOverflow = new AtomicBoolean();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final CompletableFuture<Void> stdoutPump;
    private final CompletableFuture<Void> stderrPump;

    private CgiProcessHandle(Process process, byte[] body, long maxStdout, long maxStderr, ExecutorService pumps) {
        this.process = process;
        this.maxStdout = maxStdout;
        CompletableFuture.runAsync(() -> writeStdin(body), pumps);
        this.stdoutPump = CompletableFuture.runAsync(this::pumpStdout, pumps);
        this.stderrPump = CompletableFuture.runAsync(() -> pumpStderr(maxStderr), pumps);
    }

    /**
     * Starts the process and its pumps.
     *
     * @throws IOException if the interpreter cannot be spawned
     */
    static CgiProcessHandle start(ProcessBuilder builder, byte[] body, long maxStdout, long maxStderr,
                                  ExecutorService pumps) throws IOException {
        Process process = builder.start();
        return new CgiProcessHandle(process, body, maxStdout, maxStderr, pumps);
    }

    /**
     * Waits for the process to finish within {@code timeoutMs}. On expiry the
     * process is sent a termination signal, followed by a forced kill after
     * {@code killGraceMs} if it is still alive; this method does not wait for
     * either.
     */
    Termination await(long timeoutMs, long killGraceMs) throws InterruptedException {
        boolean exited = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        if (!exited) {
            log.warn("CGI script execution timed out after {}ms", timeoutMs);
            terminate(killGraceMs);
            return new Termination(Outcome.TIMED_OUT, -1);
        }

        // exit does not guarantee the pipes are drained
        awaitPump(stdoutPump, killGraceMs);
        awaitPump(stderrPump, killGraceMs);

        int exitCode = process.exitValue();
        if (stdoutOverflow.get()) {
            return new Termination(Outcome.OUTPUT_LIMIT_EXCEEDED, exitCode);
        }
        if (exitCode > SIGNAL_EXIT_BASE) {
            return new Termination(Outcome.SIGNALED, exitCode);
        }
        return new Termination(Outcome.EXITED, exitCode);
    }

    /**
     * Sends the termination signal now and a forced kill after {@code killGraceMs}.
     */
    void terminate(long killGraceMs) {
        process.destroy();
        process.onExit()
                .completeOnTimeout(null, killGraceMs, TimeUnit.MILLISECONDS)
                .thenRun(() -> {
                    if (process.isAlive()) {
                        log.warn("CGI process {} ignored termination signal, killing", process.pid());
                        process.destroyForcibly();
                    }
                });
    }

    byte[] stdout() {
        synchronized (stdout) {
            return stdout.toByteArray();
        }
    }

    String stderr() {
        synchronized (stderr) {
            return stderr.toString(StandardCharsets.UTF_8);
        }
    }

    long pid() {
        return process.pid();
    }

    private void writeStdin(byte[] body) {
        try (OutputStream in = process.getOutputStream()) {
            if (body != null && body.length > 0) {
                in.write(body);
            }
        } catch (IOException e) {
            // the script exited or closed stdin without reading the body
            log.debug("CGI stdin closed early: {}", e.getMessage());
        }
    }

    private void pumpStdout() {
        byte[] buf = new byte[8192];
        long total = 0;
        try (InputStream out = process.getInputStream()) {
            int n;
            while ((n = out.read(buf)) >= 0) {
                total += n;
                if (total > maxStdout) {
                    log.error("CGI response size exceeded maximum of {} bytes", maxStdout);
                    stdoutOverflow.set(true);
                    process.destroy();
                    return;
                }
                synchronized (stdout) {
                    stdout.write(buf, 0, n);
                }
            }
        } catch (IOException e) {
            log.debug("CGI stdout closed: {}", e.getMessage());
        }
    }

    private void pumpStderr(long maxStderr) {
        byte[] buf = new byte[4096];
        long total = 0;
        try (InputStream err = process.getErrorStream()) {
            int n;
            while ((n = err.read(buf)) >= 0) {
                total += n;
                if (total <= maxStderr) {
                    synchronized (stderr) {
                        stderr.write(buf, 0, n);
                    }
                }
            }
        } catch (IOException e) {
            log.debug("CGI stderr closed: {}", e.getMessage());
        }
    }

    private static void awaitPump(CompletableFuture<Void> pump, long timeoutMs) throws InterruptedException {
        try {
            pump.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("CGI output pump did not finish cleanly: {}", e.toString());
        }
    }
}
