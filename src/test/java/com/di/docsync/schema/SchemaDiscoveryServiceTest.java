package com.di.docsync.schema;

import com.di.docsync.source.H2TestSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import com.di.docsync.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaDiscoveryService Tests")
class SchemaDiscoveryServiceTest {

    private H2TestSource source;
    private SchemaDiscoveryService service;

    @BeforeEach
    void setUp() {
        source = H2TestSource.create().execute(
                "CREATE TABLE projects (id INTEGER PRIMARY KEY, name VARCHAR(100), created_at TIMESTAMP, updated_at TIMESTAMP)",
                "CREATE TABLE categories (id INTEGER PRIMARY KEY, label VARCHAR(50))",
                "CREATE TABLE photos (id INTEGER PRIMARY KEY, project_id INTEGER, category_id INTEGER, owner_id INTEGER,"
                        + " caption VARCHAR(200), s3_key VARCHAR(255), url VARCHAR(500), notes_path VARCHAR(100),"
                        + " created_at TIMESTAMP, updated_at TIMESTAMP)",
                "CREATE TABLE documents (id INTEGER PRIMARY KEY, project_id INTEGER, attachments VARCHAR(1000),"
                        + " file_map VARCHAR(1000), last_synced_at TIMESTAMP WITH TIME ZONE)",
                "INSERT INTO projects VALUES (1, 'Bridge', TIMESTAMP '2024-01-01 00:00:00', TIMESTAMP '2024-01-02 00:00:00')",
                "INSERT INTO projects VALUES (2, 'Tower', TIMESTAMP '2024-01-01 00:00:00', TIMESTAMP '2024-01-02 00:00:00')",
                "INSERT INTO photos VALUES (9, 1, NULL, 7, 'north side', '12/345/photos/9/site.jpg',"
                        + " 'https://cdn.example.com/p/9/site.jpg?sig=abc', 'not a path',"
                        + " TIMESTAMP '2024-01-01 00:00:00', TIMESTAMP '2024-01-05 00:00:00')",
                "INSERT INTO documents VALUES (1, 1, '{\"site_plan\":\"12/345/docs/plan.pdf\",\"photo\":\"12/345/docs/a.jpg\"}',"
                        + " NULL, NULL)");
        service = new SchemaDiscoveryService(source.connectionManager(), "public", "test-source",
                new MetricsCollector(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        source.shutdown();
    }

    // ============================================================================
    // Tables and columns
    // ============================================================================

    @Test
    @DisplayName("Should discover every base table in name order")
    void testDiscover_Tables() {
        SchemaMap map = service.discover();

        assertEquals("test-source", map.sourceName());
        assertNotNull(map.discoveredAt());
        assertEquals(List.of("categories", "documents", "photos", "projects"),
                map.tables().stream().map(Table::name).toList());
        assertTrue(map.tables().stream().noneMatch(Table::hasError));
    }

    @Test
    @DisplayName("Should read columns, nullability and row counts")
    void testDiscover_Columns() {
        Table projects = service.discover().table("projects").orElseThrow();

        assertEquals(List.of("id", "name", "created_at", "updated_at"),
                projects.columns().stream().map(Column::name).toList());
        assertEquals(2, projects.rowCountEstimate());
        assertFalse(projects.column("id").orElseThrow().nullable());
        assertTrue(projects.column("name").orElseThrow().nullable());
        assertEquals(100, projects.column("name").orElseThrow().maxLength());
        assertEquals("id", projects.primaryKey().orElseThrow());
    }

    @Test
    @DisplayName("Should rank watermark candidates with updated before created")
    void testDiscover_Watermarks() {
        SchemaMap map = service.discover();

        assertEquals(List.of("updated_at", "created_at"), map.table("photos").orElseThrow().watermarkColumns());
        assertEquals(List.of("last_synced_at"), map.table("documents").orElseThrow().watermarkColumns());
        assertTrue(map.table("categories").orElseThrow().watermarkColumns().isEmpty());
        assertTrue(map.table("categories").orElseThrow().preferredWatermark().isEmpty());
    }

    // ============================================================================
    // File references
    // ============================================================================

    @Test
    @DisplayName("Should detect key, URL and map columns whose values have the right shape")
    void testDiscover_FileReferences() {
        SchemaMap map = service.discover();
        Table photos = map.table("photos").orElseThrow();
        Table documents = map.table("documents").orElseThrow();

        assertEquals(FileReferenceType.DIRECT_KEY, photos.fileReference("s3_key").orElseThrow().referenceType());
        assertEquals(FileReferenceType.SIGNED_URL, photos.fileReference("url").orElseThrow().referenceType());
        assertFalse(photos.isFileReference("notes_path"), "values without a path shape are rejected");
        assertFalse(photos.isFileReference("caption"));
        assertEquals(FileReferenceType.KEY_VALUE_MAP, documents.fileReference("attachments").orElseThrow().referenceType());
        assertTrue(documents.isFileReference("file_map"), "an all-null column is accepted on its name");

        assertEquals(4, map.fileReferencesSummary().totalFileReferenceColumns());
        assertEquals(List.of("documents", "photos"), map.fileReferencesSummary().tablesWithFiles());
    }

    // ============================================================================
    // Relationships
    // ============================================================================

    @Test
    @DisplayName("Should infer relationships only where the target table exists")
    void testDiscover_Relationships() {
        SchemaMap map = service.discover();

        List<String> photoLinks = map.relationshipsFrom("photos").stream()
                .map(r -> r.sourceColumn() + "->" + r.targetTable())
                .toList();
        assertEquals(List.of("project_id->projects", "category_id->categories"), photoLinks);
        assertEquals(2, map.relationshipsTo("projects").size());
    }

    @Test
    @DisplayName("Should report the configured schema only")
    void testDiscover_OtherSchemaIgnored() {
        source.execute("CREATE SCHEMA audit", "CREATE TABLE audit.events (id INTEGER PRIMARY KEY)");

        SchemaMap map = service.discover();

        assertTrue(map.table("events").isEmpty());
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    @Test
    @DisplayName("Should only consider timestamp columns with change-tracking names")
    void testWatermarkCandidates() {
        List<Column> columns = List.of(
                new Column("created_at", "timestamp", true, null, null),
                new Column("modified_on", "timestamp with time zone", true, null, null),
                new Column("updated_at", "text", true, null, null),
                new Column("published_at", "timestamp", true, null, null));

        assertEquals(List.of("modified_on", "created_at"), SchemaDiscoveryService.watermarkCandidates(columns));
    }

    @Test
    @DisplayName("Should pick the reference type from the column name and kind")
    void testTypeByName() {
        assertEquals(FileReferenceType.DIRECT_KEY,
                SchemaDiscoveryService.typeByName(new Column("storage_key", "text", true, null, null)).orElseThrow());
        assertEquals(FileReferenceType.SIGNED_URL,
                SchemaDiscoveryService.typeByName(new Column("download_url", "varchar", true, null, null)).orElseThrow());
        assertEquals(FileReferenceType.KEY_VALUE_MAP,
                SchemaDiscoveryService.typeByName(new Column("s3_keys", "jsonb", true, null, null)).orElseThrow());
        assertTrue(SchemaDiscoveryService.typeByName(new Column("s3_key", "integer", true, null, null)).isEmpty());
        assertTrue(SchemaDiscoveryService.typeByName(new Column("title", "text", true, null, null)).isEmpty());
    }
}
