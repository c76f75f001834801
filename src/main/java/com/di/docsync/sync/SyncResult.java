package com.di.docsync.sync;

import java.time.Instant;
import java.util.List;

/**
 * Report of a run: per-table counters, totals and every structured error. Partial success is a normal outcome;
 * read the counters, not just {@code status}.
 */
public record SyncResult(String jobId, SyncMode mode, JobStatus status, boolean dryRun, Instant startedAt,
                         Instant finishedAt, List<TableResult> tables, long totalRowsProcessed, long totalRowsFailed,
                         long totalFilesDownloaded, long totalFilesFailed, List<SyncError> errors,
                         List<String> warnings, String fatalError) {

    public TableResult table(String name) {
        return tables.stream().filter(t -> t.table().equals(name)).findFirst().orElse(null);
    }
}
