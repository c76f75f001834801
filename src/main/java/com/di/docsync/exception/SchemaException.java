package com.di.docsync.exception;

/**
 * Catalog introspection failed for one table. Discovery records the table with an error flag
 * and carries on with the rest.
 */
public class SchemaException extends IngestionException {

    private final String table;

    public SchemaException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
