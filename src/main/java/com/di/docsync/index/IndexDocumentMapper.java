package com.di.docsync.index;

import com.di.docsync.files.DetectedFile;
import com.di.docsync.files.DownloadResult;
import com.di.docsync.files.DownloadStatus;
import com.di.docsync.schema.Column;
import com.di.docsync.schema.FileReferenceColumn;
import com.di.docsync.schema.ImplicitRelationship;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.schema.SchemaMapRenderer;
import com.di.docsync.schema.Table;
import com.di.docsync.transform.IngestedRecord;
import com.di.docsync.transform.RelationshipRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes index documents.
 * <p>A record document carries the serialized row as {@code metadata}, its outgoing relationships and file
 * references as JSON strings, navigation hints for tables pointing at it, and the table's description
 * and column types. Discovery also produces one {@code table:<name>} document per table and one
 * {@code schema:<source>} summary.
 */
public class IndexDocumentMapper {

    public static final String SCHEMA_SOURCE_TABLE = "_schema";

    private static final ObjectWriter JSON = new ObjectMapper().writer()
            .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Map<String, String> tableDescriptions;

    public IndexDocumentMapper(Map<String, String> tableDescriptions) {
        this.tableDescriptions = tableDescriptions == null ? Map.of() : Map.copyOf(tableDescriptions);
    }

    /**
     * Document fields for a record. File references absent from {@code downloads} are reported as pending.
     */
    public Map<String, Object> toDocument(SchemaMap schemaMap, IngestedRecord record,
                                          Map<String, DownloadResult> downloads) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("doc_id", record.documentId());
        doc.put("source_table", record.sourceTable());
        doc.put("source_id", record.sourceRowId());
        if (record.partitionKey() != null) {
            doc.put("project_id", record.partitionKey());
        }
        doc.put("metadata", record.fields());
        doc.put("relationships", record.relationships().stream().map(IndexDocumentMapper::relationshipJson).toList());
        doc.put("file_references", record.fileReferences().stream()
                .map(f -> fileJson(f, downloads.get(f.reference())))
                .toList());
        doc.put("content_text", record.contentText());
        if (record.sourceModifiedAt() != null) {
            doc.put("source_modified_at", record.sourceModifiedAt());
        }
        doc.put("ingested_at", DateTimeFormatter.ISO_INSTANT.format(record.ingestedAt()));
        if (record.skippedRelationships() > 0) {
            doc.put("skipped_relationships", record.skippedRelationships());
        }
        String description = tableDescriptions.get(record.sourceTable());
        if (description != null) {
            doc.put("table_description", description);
        }
        schemaMap.table(record.sourceTable()).ifPresent(t -> doc.put("column_types", columnTypes(t)));
        List<String> incoming = incomingHints(schemaMap, record.sourceTable(), record.sourceRowId());
        if (!incoming.isEmpty()) {
            doc.put("incoming_relationships", incoming);
        }
        return doc;
    }

    public static String tableDocumentId(String table) {
        return "table:" + table;
    }

    public static String schemaDocumentId(String sourceName) {
        return "schema:" + sourceName;
    }

    public Map<String, Object> toTableDocument(SchemaMap schemaMap, Table table) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("doc_id", tableDocumentId(table.name()));
        doc.put("source_table", SCHEMA_SOURCE_TABLE);
        doc.put("source_id", table.name());
        doc.put("row_count_estimate", table.rowCountEstimate());
        doc.put("column_types", columnTypes(table));
        doc.put("watermark_columns", table.watermarkColumns());
        doc.put("file_reference_columns", table.fileReferenceColumns().stream()
                .map(FileReferenceColumn::columnName).toList());
        List<String> relationships = new ArrayList<>();
        for (ImplicitRelationship rel : schemaMap.relationshipsFrom(table.name())) {
            relationships.add(toJson(Map.of("source_column", rel.sourceColumn(), "target_table", rel.targetTable(),
                    "direction", RelationshipRef.OUTGOING, "cardinality", rel.cardinality().label())));
        }
        for (ImplicitRelationship rel : schemaMap.relationshipsTo(table.name())) {
            relationships.add(toJson(Map.of("source_table", rel.sourceTable(), "source_column", rel.sourceColumn(),
                    "direction", RelationshipRef.INCOMING,
                    "cardinality", ImplicitRelationship.Cardinality.ONE_TO_MANY.label())));
        }
        doc.put("relationships", relationships);
        String description = tableDescriptions.get(table.name());
        if (description != null) {
            doc.put("table_description", description);
        }
        StringBuilder text = new StringBuilder(table.name());
        if (description != null) {
            text.append(' ').append(description);
        }
        table.columns().forEach(c -> text.append(' ').append(c.name()));
        doc.put("content_text", text.toString());
        if (table.hasError()) {
            doc.put("discovery_error", table.discoveryError());
        }
        return doc;
    }

    public Map<String, Object> toSchemaDocument(SchemaMap schemaMap) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("doc_id", schemaDocumentId(schemaMap.sourceName()));
        doc.put("source_table", SCHEMA_SOURCE_TABLE);
        doc.put("source_id", schemaMap.sourceName());
        doc.put("discovered_at", DateTimeFormatter.ISO_INSTANT.format(schemaMap.discoveredAt()));
        doc.put("table_count", schemaMap.tables().size());
        doc.put("relationship_count", schemaMap.relationships().size());
        doc.put("tables_with_files", schemaMap.fileReferencesSummary().tablesWithFiles());
        doc.put("content_text", SchemaMapRenderer.toMarkdown(schemaMap));
        return doc;
    }

    // ------------------------------------------------------------------

    private static Map<String, String> columnTypes(Table table) {
        Map<String, String> types = new LinkedHashMap<>();
        for (Column column : table.columns()) {
            types.put(column.name(), column.declaredType());
        }
        return types;
    }

    private static String relationshipJson(RelationshipRef ref) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("target_doc_id", ref.targetDocId());
        m.put("target_table", ref.targetTable());
        m.put("target_id", ref.targetId());
        m.put("source_column", ref.sourceColumn());
        m.put("relationship_type", ref.relationshipType());
        m.put("direction", ref.direction());
        m.put("cardinality", ref.cardinality());
        return toJson(m);
    }

    private static String fileJson(DetectedFile file, DownloadResult result) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("reference", file.reference());
        if (file.key() != null) {
            m.put("key", file.key());
        }
        m.put("source_column", file.sourceColumn());
        if (file.mapKey() != null) {
            m.put("map_key", file.mapKey());
        }
        if (file.filename() != null) {
            m.put("filename", file.filename());
        }
        if (file.fileType() != null) {
            m.put("file_type", file.fileType());
        }
        DownloadStatus status = result == null ? DownloadStatus.PENDING : result.status();
        m.put("download_status", status.label());
        if (result != null && result.localPath() != null) {
            m.put("local_path", result.localPath());
        }
        if (result != null && result.reason() != null) {
            m.put("download_reason", result.reason());
        }
        return toJson(m);
    }

    private static List<String> incomingHints(SchemaMap schemaMap, String table, String rowId) {
        List<String> hints = new ArrayList<>();
        for (ImplicitRelationship rel : schemaMap.relationshipsTo(table)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("source_table", rel.sourceTable());
            m.put("source_column", rel.sourceColumn());
            m.put("relationship_type", singular(rel.sourceTable()));
            m.put("cardinality", ImplicitRelationship.Cardinality.ONE_TO_MANY.label());
            m.put("query_hint", "Find " + rel.sourceTable() + " where " + rel.sourceColumn() + " = " + rowId);
            hints.add(toJson(m));
        }
        return hints;
    }

    private static String singular(String table) {
        if (table.endsWith("ies")) {
            return table.substring(0, table.length() - 3) + "y";
        }
        return table.endsWith("s") ? table.substring(0, table.length() - 1) : table;
    }

    private static String toJson(Map<String, ?> value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize index field: " + e.getMessage(), e);
        }
    }
}
