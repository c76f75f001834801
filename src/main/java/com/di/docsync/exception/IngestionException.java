package com.di.docsync.exception;

/**
 * Base class for every failure raised by the ingestion pipeline.
 * <p>Subclasses mark the isolation level the orchestrator applies: connection failures are
 * run-fatal, schema failures isolate a table, transform/index failures isolate a row and
 * download failures isolate a single file reference.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
