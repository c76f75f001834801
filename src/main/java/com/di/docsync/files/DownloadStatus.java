package com.di.docsync.files;

public enum DownloadStatus {
    PENDING,
    SUCCESS,
    SKIPPED,
    FAILED;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
