package com.di.docsync.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for sync runs: row outcomes per table, file outcomes, batch latency,
 * schema discovery latency and source connection failures.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Timer schemaDiscoveryTimer;
    private final Counter connectionFailureCounter;
    private final Counter runCounter;
    private final Counter runFailureCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.schemaDiscoveryTimer = Timer.builder("docsync.schema.discovery.duration")
                .description("Time taken to introspect the source catalog")
                .register(meterRegistry);

        this.connectionFailureCounter = Counter.builder("docsync.source.connection.failures")
                .description("Source connection attempts that failed")
                .register(meterRegistry);

        this.runCounter = Counter.builder("docsync.sync.runs")
                .description("Sync runs that reached a terminal state")
                .tag("status", "finished")
                .register(meterRegistry);

        this.runFailureCounter = Counter.builder("docsync.sync.runs")
                .description("Sync runs that failed on a run-fatal error")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    // ============================================================================
    // Rows and batches
    // ============================================================================

    public void recordBatch(String table, int processed, int failed, long durationMs) {
        meterRegistry.counter("docsync.rows", "table", table, "outcome", "processed").increment(processed);
        if (failed > 0) {
            meterRegistry.counter("docsync.rows", "table", table, "outcome", "failed").increment(failed);
        }
        meterRegistry.timer("docsync.batch.duration", "table", table).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded batch: table={}, processed={}, failed={}, durationMs={}", table, processed, failed, durationMs);
    }

    public void recordDeletes(String table, int deleted) {
        meterRegistry.counter("docsync.rows", "table", table, "outcome", "deleted").increment(deleted);
    }

    // ============================================================================
    // Files
    // ============================================================================

    public void recordFile(String status) {
        meterRegistry.counter("docsync.files", "status", status).increment();
    }

    // ============================================================================
    // Discovery, connections, runs
    // ============================================================================

    public void recordSchemaDiscovery(long durationMs) {
        schemaDiscoveryTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordConnectionFailure() {
        connectionFailureCounter.increment();
    }

    public void recordRun(boolean failed) {
        (failed ? runFailureCounter : runCounter).increment();
    }
}
