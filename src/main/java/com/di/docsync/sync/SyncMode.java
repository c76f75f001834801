package com.di.docsync.sync;

public enum SyncMode {
    FULL,
    INCREMENTAL,
    SCHEMA_DISCOVERY
}
