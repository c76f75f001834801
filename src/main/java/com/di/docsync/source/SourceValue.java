package com.di.docsync.source;

/**
 * One column value as read from the source, tagged with the kind the driver reported for it.
 * {@code raw} is {@code null} for SQL NULL.
 */
public record SourceValue(ColumnKind kind, Object raw) {

    public static SourceValue nullOf(ColumnKind kind) {
        return new SourceValue(kind, null);
    }

    public boolean isNull() {
        return raw == null;
    }
}
