package com.di.docsync.sync;

import com.di.docsync.checkpoint.Checkpoint;

import java.util.List;

/**
 * Engine-wide view: every table with a checkpoint, running totals from the checkpoints, and the active job.
 */
public record SyncStatus(int tablesMonitored, long totalRowsProcessed, long totalRowsFailed, String currentJobId,
                         List<Checkpoint> checkpoints) {
}
