package com.di.docsync.sync;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One run. Created and mutated only by the orchestrator; once terminal its state no longer changes.
 */
@Slf4j
public final class SyncJob {

    private final String jobId;
    private final SyncMode mode;
    private final SyncRequest request;
    private final CancellationToken cancellation = new CancellationToken();
    private final Map<String, TableProgress> tables = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<SyncError> errors = new CopyOnWriteArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedQueue<CompletableFuture<Void>> pendingFollowUps = new ConcurrentLinkedQueue<>();

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String fatalError;

    SyncJob(SyncMode mode, SyncRequest request) {
        this.jobId = UUID.randomUUID().toString();
        this.mode = mode;
        this.request = request;
    }

    public String getJobId() {
        return jobId;
    }

    public SyncMode getMode() {
        return mode;
    }

    public SyncRequest getRequest() {
        return request;
    }

    public JobStatus getStatus() {
        return status;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    synchronized void markRunning() {
        requireStatus(JobStatus.PENDING);
        status = JobStatus.RUNNING;
        startedAt = Instant.now();
    }

    synchronized void finish(JobStatus terminal, String fatal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            return;
        }
        status = terminal;
        fatalError = fatal;
        finishedAt = Instant.now();
        if (startedAt == null) {
            startedAt = finishedAt;
        }
        log.info("[SYNC] Job {} {} -> {}", jobId, mode, terminal);
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + jobId + " is " + status + ", expected " + expected);
        }
    }

    // ------------------------------------------------------------------
    // Accumulation
    // ------------------------------------------------------------------

    TableProgress progress(String table) {
        return tables.computeIfAbsent(table, TableProgress::new);
    }

    void addError(SyncError error) {
        if (!status.isTerminal()) {
            errors.add(error);
        }
    }

    void addWarning(String warning) {
        if (!status.isTerminal()) {
            warnings.add(warning);
        }
    }

    void trackFollowUp(CompletableFuture<Void> followUp) {
        pendingFollowUps.add(followUp);
    }

    List<CompletableFuture<Void>> followUps() {
        return new ArrayList<>(pendingFollowUps);
    }

    public SyncResult toResult() {
        List<TableResult> snapshot;
        synchronized (tables) {
            snapshot = tables.values().stream().map(TableProgress::snapshot).toList();
        }
        return new SyncResult(jobId, mode, status, request.isDryRun(), startedAt, finishedAt, snapshot,
                snapshot.stream().mapToLong(TableResult::rowsProcessed).sum(),
                snapshot.stream().mapToLong(TableResult::rowsFailed).sum(),
                snapshot.stream().mapToLong(TableResult::filesDownloaded).sum(),
                snapshot.stream().mapToLong(TableResult::filesFailed).sum(),
                List.copyOf(errors), List.copyOf(warnings), fatalError);
    }
}
