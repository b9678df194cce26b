package com.gamezip.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for archive mounts, file serving and CGI execution.
 */
@Service
public class GameZipMetrics {

    private final MeterRegistry registry;

    public GameZipMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMount(boolean success) {
        Counter.builder("gamezip.mounts.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordUnmount(boolean removed) {
        Counter.builder("gamezip.unmounts.total")
                .tag("result", removed ? "removed" : "not_mounted")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a file-serving lookup.
     *
     * @param result {@code hit}, {@code miss}, {@code cgi} or {@code rejected}
     */
    public void recordFileRequest(String result) {
        Counter.builder("gamezip.files.requests")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordBytesServed(long bytes) {
        Counter.builder("gamezip.files.bytes")
                .baseUnit("bytes")
                .register(registry)
                .increment(bytes);
    }

    public void recordCgiExecution(String outcome, long ms) {
        Timer.builder("gamezip.cgi.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
