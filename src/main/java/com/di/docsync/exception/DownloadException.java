package com.di.docsync.exception;

/**
 * Fetching an asset failed. Recorded on the file's download result; never blocks indexing
 * of the owning record.
 */
public class DownloadException extends IngestionException {

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
