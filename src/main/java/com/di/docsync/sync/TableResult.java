package com.di.docsync.sync;

import java.util.List;

/**
 * Per-table counters of a run, frozen at the time it was taken.
 */
public record TableResult(String table, JobStatus status, long rowsProcessed, long rowsFailed, long inserts,
                          long updates, long deletes, long filesDownloaded, long filesSkipped, long filesFailed,
                          long relationshipsSkipped, String lastWatermark, List<String> warnings) {
}
