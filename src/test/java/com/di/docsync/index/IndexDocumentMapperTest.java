package com.di.docsync.index;

import com.di.docsync.files.DetectedFile;
import com.di.docsync.files.DownloadResult;
import com.di.docsync.schema.Column;
import com.di.docsync.schema.FileReferenceColumn;
import com.di.docsync.schema.FileReferenceType;
import com.di.docsync.schema.ImplicitRelationship;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.schema.Table;
import com.di.docsync.transform.IngestedRecord;
import com.di.docsync.transform.RelationshipRef;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IndexDocumentMapper Tests")
class IndexDocumentMapperTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private SchemaMap schemaMap;
    private IndexDocumentMapper mapper;

    @BeforeEach
    void setUp() {
        Table projects = new Table("projects", 2, List.of(
                new Column("id", "integer", false, null, null),
                new Column("name", "text", true, null, null)),
                List.of(), List.of(), null);
        Table photos = new Table("photos", 10, List.of(
                new Column("id", "integer", false, null, null),
                new Column("project_id", "integer", true, null, null),
                new Column("s3_key", "text", true, null, null),
                new Column("updated_at", "timestamp without time zone", true, null, null)),
                List.of("updated_at"), List.of(FileReferenceColumn.of("s3_key", FileReferenceType.DIRECT_KEY)), null);
        schemaMap = new SchemaMap(Instant.parse("2024-06-01T00:00:00Z"), "sitebase", List.of(projects, photos),
                List.of(ImplicitRelationship.manyToOne("photos", "project_id", "projects")));
        mapper = new IndexDocumentMapper(Map.of("photos", "Site photos taken during inspections"));
    }

    private IngestedRecord photoRecord() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("id", "9");
        fields.put("project_id", "1");
        fields.put("s3_key", "1/photos/9/north.jpg");
        fields.put("updated_at", "2024-01-02T00:00:00.000000Z");
        RelationshipRef ref = new RelationshipRef("projects:1", "projects", "1", "project_id", "project",
                RelationshipRef.OUTGOING, "many_to_one");
        DetectedFile file = new DetectedFile("1/photos/9/north.jpg", null, "photos", "9", "s3_key", null,
                "north.jpg", null);
        return new IngestedRecord("photos:9", "photos", "9", "1", fields, List.of(ref), List.of(file), "",
                "2024-01-02T00:00:00.000000Z", Instant.parse("2024-06-01T12:00:00Z"), 0);
    }

    private static Map<String, Object> parse(Object json) throws Exception {
        return JSON.readValue(json.toString(), new TypeReference<Map<String, Object>>() {
        });
    }

    // ============================================================================
    // Record documents
    // ============================================================================

    @Test
    @DisplayName("Should carry identity, metadata and table context")
    void testToDocument_Fields() {
        Map<String, Object> doc = mapper.toDocument(schemaMap, photoRecord(), Map.of());

        assertEquals("photos:9", doc.get("doc_id"));
        assertEquals("photos", doc.get("source_table"));
        assertEquals("9", doc.get("source_id"));
        assertEquals("1", doc.get("project_id"));
        assertEquals("1/photos/9/north.jpg", ((Map<?, ?>) doc.get("metadata")).get("s3_key"));
        assertEquals("2024-01-02T00:00:00.000000Z", doc.get("source_modified_at"));
        assertEquals("2024-06-01T12:00:00Z", doc.get("ingested_at"));
        assertEquals("Site photos taken during inspections", doc.get("table_description"));
        assertEquals("integer", ((Map<?, ?>) doc.get("column_types")).get("project_id"));
        assertFalse(doc.containsKey("skipped_relationships"));
        assertFalse(doc.containsKey("incoming_relationships"));
    }

    @Test
    @DisplayName("Should serialize relationships as JSON strings")
    void testToDocument_Relationships() throws Exception {
        Map<String, Object> doc = mapper.toDocument(schemaMap, photoRecord(), Map.of());

        List<?> relationships = (List<?>) doc.get("relationships");
        assertEquals(1, relationships.size());
        Map<String, Object> rel = parse(relationships.get(0));
        assertEquals("projects:1", rel.get("target_doc_id"));
        assertEquals("project", rel.get("relationship_type"));
        assertEquals("outgoing", rel.get("direction"));
        assertEquals("many_to_one", rel.get("cardinality"));
    }

    @Test
    @DisplayName("Should report files without a result as pending")
    void testToDocument_PendingFile() throws Exception {
        Map<String, Object> doc = mapper.toDocument(schemaMap, photoRecord(), Map.of());

        Map<String, Object> file = parse(((List<?>) doc.get("file_references")).get(0));
        assertEquals("pending", file.get("download_status"));
        assertEquals("jpg", file.get("file_type"));
        assertEquals("s3_key", file.get("source_column"));
        assertFalse(file.containsKey("local_path"));
    }

    @Test
    @DisplayName("Should report download outcomes")
    void testToDocument_DownloadResults() throws Exception {
        String reference = "1/photos/9/north.jpg";
        Map<String, Object> done = mapper.toDocument(schemaMap, photoRecord(),
                Map.of(reference, DownloadResult.success(reference, "/data/files/photos/9/north.jpg", 512)));
        Map<String, Object> failed = mapper.toDocument(schemaMap, photoRecord(),
                Map.of(reference, DownloadResult.failed(reference, "not found")));

        Map<String, Object> success = parse(((List<?>) done.get("file_references")).get(0));
        assertEquals("success", success.get("download_status"));
        assertEquals("/data/files/photos/9/north.jpg", success.get("local_path"));
        Map<String, Object> failure = parse(((List<?>) failed.get("file_references")).get(0));
        assertEquals("failed", failure.get("download_status"));
        assertEquals("not found", failure.get("download_reason"));
    }

    @Test
    @DisplayName("Should add query hints for tables pointing at the record")
    void testToDocument_IncomingHints() throws Exception {
        IngestedRecord project = new IngestedRecord("projects:1", "projects", "1", null, Map.of("id", "1", "name", "Bridge"),
                List.of(), List.of(), "Bridge", null, Instant.parse("2024-06-01T12:00:00Z"), 0);

        Map<String, Object> doc = mapper.toDocument(schemaMap, project, Map.of());

        assertFalse(doc.containsKey("project_id"));
        assertFalse(doc.containsKey("source_modified_at"));
        List<?> incoming = (List<?>) doc.get("incoming_relationships");
        assertEquals(1, incoming.size());
        Map<String, Object> hint = parse(incoming.get(0));
        assertEquals("photos", hint.get("source_table"));
        assertEquals("photo", hint.get("relationship_type"));
        assertEquals("one_to_many", hint.get("cardinality"));
        assertEquals("Find photos where project_id = 1", hint.get("query_hint"));
    }

    // ============================================================================
    // Schema documents
    // ============================================================================

    @Test
    @DisplayName("Should describe a table in both directions")
    void testToTableDocument() {
        Map<String, Object> doc = mapper.toTableDocument(schemaMap, schemaMap.table("projects").orElseThrow());

        assertEquals("table:projects", doc.get("doc_id"));
        assertEquals(IndexDocumentMapper.SCHEMA_SOURCE_TABLE, doc.get("source_table"));
        assertEquals(2L, doc.get("row_count_estimate"));
        List<?> relationships = (List<?>) doc.get("relationships");
        assertEquals(1, relationships.size());
        assertTrue(relationships.get(0).toString().contains("\"direction\":\"incoming\""));
        assertEquals("projects id name", doc.get("content_text"));
    }

    @Test
    @DisplayName("Should list file columns and flag discovery errors")
    void testToTableDocument_FilesAndErrors() {
        Map<String, Object> photos = mapper.toTableDocument(schemaMap, schemaMap.table("photos").orElseThrow());
        Map<String, Object> broken = mapper.toTableDocument(schemaMap, Table.failed("legacy", "permission denied"));

        assertEquals(List.of("s3_key"), photos.get("file_reference_columns"));
        assertEquals(List.of("updated_at"), photos.get("watermark_columns"));
        assertTrue(photos.get("content_text").toString().startsWith("photos Site photos taken during inspections"));
        assertEquals("permission denied", broken.get("discovery_error"));
    }

    @Test
    @DisplayName("Should summarize the whole schema")
    void testToSchemaDocument() {
        Map<String, Object> doc = mapper.toSchemaDocument(schemaMap);

        assertEquals("schema:sitebase", doc.get("doc_id"));
        assertEquals("2024-06-01T00:00:00Z", doc.get("discovered_at"));
        assertEquals(2, doc.get("table_count"));
        assertEquals(1, doc.get("relationship_count"));
        assertEquals(List.of("photos"), doc.get("tables_with_files"));
        assertTrue(doc.get("content_text").toString().contains("projects"));
    }
}
