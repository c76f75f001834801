package com.di.docsync.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A source row: column name to tagged value, in result-set column order.
 * The record transformer is the only component that interprets the values.
 */
public final class SourceRow {

    public static final String ID_COLUMN = "id";

    private final Map<String, SourceValue> values;

    public SourceRow(Map<String, SourceValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Convenience for tests and fixtures: untyped values tagged {@link ColumnKind#OTHER}.
     */
    public static SourceRow of(Map<String, ?> raw) {
        Map<String, SourceValue> tagged = new LinkedHashMap<>();
        raw.forEach((k, v) -> tagged.put(k, new SourceValue(ColumnKind.OTHER, v)));
        return new SourceRow(tagged);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, SourceValue> values() {
        return values;
    }

    public SourceValue value(String column) {
        return values.get(column);
    }

    /** Raw value, {@code null} when absent or SQL NULL. */
    public Object get(String column) {
        SourceValue v = values.get(column);
        return v == null ? null : v.raw();
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    /** The {@code id} column rendered as text, or {@code null} when the row has none. */
    public String idAsString() {
        Object id = get(ID_COLUMN);
        return id == null ? null : id.toString();
    }

    @Override
    public String toString() {
        return "SourceRow{id=" + idAsString() + ", columns=" + values.size() + "}";
    }
}
