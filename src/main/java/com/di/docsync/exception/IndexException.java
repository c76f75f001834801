package com.di.docsync.exception;

/**
 * The downstream index rejected a write for one document.
 */
public class IndexException extends IngestionException {

    private final String documentId;

    public IndexException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public IndexException(String documentId, String message) {
        this(documentId, message, null);
    }

    public String getDocumentId() {
        return documentId;
    }
}
