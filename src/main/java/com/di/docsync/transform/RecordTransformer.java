package com.di.docsync.transform;

import com.di.docsync.exception.TransformException;
import com.di.docsync.files.DetectedFile;
import com.di.docsync.files.FileReferenceDetector;
import com.di.docsync.schema.Column;
import com.di.docsync.schema.ImplicitRelationship;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.schema.Table;
import com.di.docsync.source.ColumnKind;
import com.di.docsync.source.SourceRow;
import com.di.docsync.source.SourceValue;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link SourceRow} into an {@link IngestedRecord}.
 * <p>The declared type from the schema map decides how each value is serialized; a column the
 * schema map does not know falls back to the type the driver reported. A null foreign key is
 * counted on the record and skipped. Any value that cannot be serialized fails the row with a
 * {@link TransformException} carrying table, row id and column.
 */
@Slf4j
public class RecordTransformer {

    private final Map<String, List<String>> contentColumns;
    private final String partitionColumn;
    private final FileReferenceDetector fileDetector;
    private final Clock clock;

    public RecordTransformer(Map<String, List<String>> contentColumns, String partitionColumn,
                             FileReferenceDetector fileDetector, Clock clock) {
        this.contentColumns = contentColumns == null ? Map.of() : Map.copyOf(contentColumns);
        this.partitionColumn = partitionColumn;
        this.fileDetector = fileDetector;
        this.clock = clock;
    }

    public IngestedRecord transform(SchemaMap schemaMap, Table table, SourceRow row) {
        String rowId = row.idAsString();
        if (rowId == null) {
            throw new TransformException(table.name(), null, "Row has no id value");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, SourceValue> e : row.values().entrySet()) {
            String serialized = serializeColumn(table, rowId, e.getKey(), e.getValue());
            if (serialized != null) {
                fields.put(e.getKey(), serialized);
            }
        }

        List<RelationshipRef> relationships = new ArrayList<>();
        int skipped = 0;
        for (ImplicitRelationship rel : schemaMap.relationshipsFrom(table.name())) {
            String targetId = fields.get(rel.sourceColumn());
            if (targetId == null) {
                skipped++;
                continue;
            }
            relationships.add(new RelationshipRef(IngestedRecord.documentId(rel.targetTable(), targetId),
                    rel.targetTable(), targetId, rel.sourceColumn(), rel.relationshipType(),
                    RelationshipRef.OUTGOING, rel.cardinality().label()));
        }
        if (skipped > 0) {
            log.debug("[TRANSFORM] {} row {}: {} null relationship column(s) skipped", table.name(), rowId, skipped);
        }

        List<DetectedFile> files = fileDetector.detect(table, row);
        String sourceModifiedAt = table.preferredWatermark().map(fields::get).orElse(null);
        String partitionKey = partitionColumn != null ? fields.get(partitionColumn) : null;

        return new IngestedRecord(IngestedRecord.documentId(table.name(), rowId), table.name(), rowId, partitionKey,
                fields, relationships, files, contentText(table, fields), sourceModifiedAt, clock.instant(), skipped);
    }

    private String serializeColumn(Table table, String rowId, String column, SourceValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        ColumnKind kind = table.column(column).map(Column::kind)
                .filter(k -> k != ColumnKind.OTHER)
                .orElse(value.kind());
        try {
            return ValueSerializer.serialize(kind, value.raw());
        } catch (RuntimeException e) {
            throw new TransformException(table.name(), rowId, column,
                    "Cannot serialize " + table.name() + "." + column + " (row " + rowId + ") as " + kind + ": "
                            + e.getMessage(), e);
        }
    }

    /**
     * Configured content columns in order, else every text column that is not a file reference.
     */
    String contentText(Table table, Map<String, String> fields) {
        List<String> configured = contentColumns.get(table.name());
        List<String> columns;
        if (configured != null && !configured.isEmpty()) {
            columns = configured;
        } else {
            columns = new ArrayList<>();
            for (Map.Entry<String, String> e : fields.entrySet()) {
                String name = e.getKey();
                boolean text = table.column(name).map(c -> c.kind() == ColumnKind.TEXT).orElse(false);
                if (text && !table.isFileReference(name)) {
                    columns.add(name);
                }
            }
        }
        List<String> parts = new ArrayList<>();
        for (String column : columns) {
            String value = fields.get(column);
            if (value != null && !value.isBlank()) {
                parts.add(value.trim());
            }
        }
        return String.join(" ", parts);
    }
}
