package com.di.docsync.exception;

/**
 * Source database unreachable, authentication refused, or a query failed at the transport level.
 * Run-fatal once the connection retry policy is exhausted.
 */
public class SourceConnectionException extends IngestionException {

    public SourceConnectionException(String message) {
        super(message);
    }

    public SourceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
