package com.di.docsync.sync;

import com.di.docsync.exception.ErrorCategory;

import java.time.Instant;

/**
 * One structured failure of a run. {@code rowId} is set for row-level errors, {@code null} for table-level ones.
 */
public record SyncError(String table, String rowId, ErrorCategory category, String message, Instant timestamp) {

    public static SyncError of(String table, String rowId, Throwable error) {
        return new SyncError(table, rowId, ErrorCategory.categorize(error), error.getMessage(), Instant.now());
    }
}
