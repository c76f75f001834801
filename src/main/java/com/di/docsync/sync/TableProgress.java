package com.di.docsync.sync;

import com.di.docsync.files.DownloadResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters for one table. Row counters are written by the table's worker only; file counters
 * also by download threads.
 */
public final class TableProgress {

    private final String table;
    private volatile JobStatus status = JobStatus.PENDING;
    private volatile String lastWatermark;
    private final AtomicLong rowsProcessed = new AtomicLong();
    private final AtomicLong rowsFailed = new AtomicLong();
    private final AtomicLong inserts = new AtomicLong();
    private final AtomicLong updates = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong filesDownloaded = new AtomicLong();
    private final AtomicLong filesSkipped = new AtomicLong();
    private final AtomicLong filesFailed = new AtomicLong();
    private final AtomicLong relationshipsSkipped = new AtomicLong();
    private final List<String> warnings = new CopyOnWriteArrayList<>();

    TableProgress(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }

    public JobStatus status() {
        return status;
    }

    void status(JobStatus status) {
        this.status = status;
    }

    void lastWatermark(String watermark) {
        this.lastWatermark = watermark;
    }

    void addProcessed(long n) {
        rowsProcessed.addAndGet(n);
    }

    void addFailed(long n) {
        rowsFailed.addAndGet(n);
    }

    void addInsert() {
        inserts.incrementAndGet();
    }

    void addUpdate() {
        updates.incrementAndGet();
    }

    void addDeletes(long n) {
        deletes.addAndGet(n);
    }

    void addRelationshipsSkipped(long n) {
        relationshipsSkipped.addAndGet(n);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    void recordFile(DownloadResult result) {
        switch (result.status()) {
            case SUCCESS -> filesDownloaded.incrementAndGet();
            case SKIPPED -> filesSkipped.incrementAndGet();
            case FAILED -> filesFailed.incrementAndGet();
            default -> {
            }
        }
    }

    public long rowsProcessed() {
        return rowsProcessed.get();
    }

    public long rowsFailed() {
        return rowsFailed.get();
    }

    public TableResult snapshot() {
        return new TableResult(table, status, rowsProcessed.get(), rowsFailed.get(), inserts.get(), updates.get(),
                deletes.get(), filesDownloaded.get(), filesSkipped.get(), filesFailed.get(),
                relationshipsSkipped.get(), lastWatermark, List.copyOf(warnings));
    }
}
