package com.di.docsync.exception;

/**
 * Thrown when an operator asks about a sync job id this process has never created.
 * Mapped to 404 by {@link GlobalExceptionHandler}.
 */
public class UnknownJobException extends RuntimeException {

    public UnknownJobException(String jobId) {
        super("Unknown sync job: " + jobId);
    }
}
