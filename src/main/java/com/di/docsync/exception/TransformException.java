package com.di.docsync.exception;

/**
 * A single row could not be serialized. The row is counted as failed; the batch continues.
 */
public class TransformException extends IngestionException {

    private final String table;
    private final String rowId;
    private final String column;

    public TransformException(String table, String rowId, String column, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.rowId = rowId;
        this.column = column;
    }

    public TransformException(String table, String rowId, String message) {
        this(table, rowId, null, message, null);
    }

    public String getTable() {
        return table;
    }

    public String getRowId() {
        return rowId;
    }

    /** Offending column, or {@code null} when the failure is not tied to one column. */
    public String getColumn() {
        return column;
    }
}
