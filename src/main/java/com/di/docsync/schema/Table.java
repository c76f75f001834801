package com.di.docsync.schema;

import java.util.List;
import java.util.Optional;

/**
 * Discovered table. {@code discoveryError} is non-null when introspection failed; such a table has no
 * columns, is left out of relationship inference and is reported instead of synced.
 */
public record Table(String name, long rowCountEstimate, List<Column> columns, List<String> watermarkColumns,
                    List<FileReferenceColumn> fileReferenceColumns, String discoveryError) {

    public Table {
        columns = List.copyOf(columns);
        watermarkColumns = List.copyOf(watermarkColumns);
        fileReferenceColumns = List.copyOf(fileReferenceColumns);
    }

    public static Table failed(String name, String error) {
        return new Table(name, 0, List.of(), List.of(), List.of(), error);
    }

    public boolean hasError() {
        return discoveryError != null;
    }

    public Optional<Column> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    /** The {@code id} column, when the table has one. */
    public Optional<String> primaryKey() {
        return column("id").map(Column::name);
    }

    /** Best watermark column (an "updated" semantic wins over "created"), if any. */
    public Optional<String> preferredWatermark() {
        return watermarkColumns.isEmpty() ? Optional.empty() : Optional.of(watermarkColumns.get(0));
    }

    public Optional<FileReferenceColumn> fileReference(String columnName) {
        return fileReferenceColumns.stream().filter(f -> f.columnName().equals(columnName)).findFirst();
    }

    public boolean isFileReference(String columnName) {
        return fileReference(columnName).isPresent();
    }

    public List<Column> timestampColumns() {
        return columns.stream().filter(c -> c.kind().isTimestamp()).toList();
    }
}
