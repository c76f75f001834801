package com.di.docsync.checkpoint;

public enum CheckpointStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
