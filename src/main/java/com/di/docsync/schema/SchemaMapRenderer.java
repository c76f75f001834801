package com.di.docsync.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured (JSON) and human-readable (Markdown) views of a {@link SchemaMap}.
 */
public final class SchemaMapRenderer {

    private static final int MAX_DEFAULT_LENGTH = 30;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private SchemaMapRenderer() {
    }

    public static Map<String, Object> toStructured(SchemaMap map) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("discoveredAt", map.discoveredAt().toString());
        out.put("sourceName", map.sourceName());
        out.put("tables", map.tables());
        out.put("relationships", map.relationships());
        out.put("fileReferencesSummary", map.fileReferencesSummary());
        return out;
    }

    public static String toJson(SchemaMap map) {
        try {
            return MAPPER.writeValueAsString(toStructured(map));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schema map is not serializable", e);
        }
    }

    public static String toMarkdown(SchemaMap map) {
        StringBuilder md = new StringBuilder();
        md.append("# Database Schema: ").append(map.sourceName()).append("\n\n");
        md.append("Discovered: ").append(map.discoveredAt()).append("\n\n");
        md.append("Tables: ").append(map.tables().size()).append("\n\n");

        List<Table> ordered = new ArrayList<>(map.tables());
        ordered.sort(Comparator.comparingLong(Table::rowCountEstimate).reversed().thenComparing(Table::name));

        for (Table table : ordered) {
            md.append("## ").append(table.name()).append(" (~").append(table.rowCountEstimate()).append(" rows)\n\n");
            if (table.hasError()) {
                md.append("**Discovery failed:** ").append(table.discoveryError()).append("\n\n");
                continue;
            }
            md.append("| Column | Type | Nullable | Default |\n");
            md.append("|--------|------|----------|---------|\n");
            for (Column c : table.columns()) {
                md.append("| ").append(c.name())
                        .append(" | ").append(c.declaredType())
                        .append(" | ").append(c.nullable() ? "YES" : "NO")
                        .append(" | ").append(truncate(c.defaultValue()))
                        .append(" |\n");
            }
            md.append('\n');
            if (!table.fileReferenceColumns().isEmpty()) {
                md.append("**File References:** ").append(table.fileReferenceColumns().stream()
                        .map(f -> f.columnName() + " (" + f.referenceType().name().toLowerCase() + ")")
                        .collect(Collectors.joining(", "))).append("\n\n");
            }
            List<Column> timestamps = table.timestampColumns();
            if (!timestamps.isEmpty()) {
                md.append("**Timestamp Columns:** ").append(timestamps.stream().map(Column::name)
                        .collect(Collectors.joining(", "))).append("\n\n");
            }
            table.preferredWatermark().ifPresent(w -> md.append("**Watermark:** ").append(w).append("\n\n"));
        }

        md.append("## Relationships\n\n");
        if (map.relationships().isEmpty()) {
            md.append("None inferred.\n\n");
        } else {
            md.append("| From | Column | To | Cardinality |\n");
            md.append("|------|--------|----|-------------|\n");
            for (ImplicitRelationship r : map.relationships()) {
                md.append("| ").append(r.sourceTable())
                        .append(" | ").append(r.sourceColumn())
                        .append(" | ").append(r.targetTable()).append('.').append(r.targetColumn())
                        .append(" | ").append(r.cardinality().label())
                        .append(" |\n");
            }
            md.append('\n');
        }

        SchemaMap.FileReferenceSummary summary = map.fileReferencesSummary();
        md.append("## File References Summary\n\n");
        md.append("- Total file reference columns: ").append(summary.totalFileReferenceColumns()).append('\n');
        md.append("- Tables with files: ").append(summary.tablesWithFiles().isEmpty() ? "none"
                : String.join(", ", summary.tablesWithFiles())).append('\n');
        return md.toString();
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > MAX_DEFAULT_LENGTH ? value.substring(0, MAX_DEFAULT_LENGTH) + "..." : value;
    }
}
