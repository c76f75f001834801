package com.di.docsync.sync;

/**
 * Lifecycle of a job, and of each table within it: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
