package com.di.docsync.checkpoint;

import com.di.docsync.source.H2TestSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcCheckpointStore Tests")
class JdbcCheckpointStoreTest {

    private H2TestSource database;
    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() {
        database = H2TestSource.create();
        store = new JdbcCheckpointStore(database.dataSource());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static Checkpoint running(String table, String watermark, String lastRowId, long processed) {
        return Checkpoint.builder()
                .table(table)
                .lastWatermark(watermark)
                .lastRowId(lastRowId)
                .rowsProcessed(processed)
                .status(CheckpointStatus.RUNNING)
                .build();
    }

    @Test
    @DisplayName("Should return empty for a table never synced")
    void testGet_Missing() {
        assertTrue(store.get("photos").isEmpty());
    }

    @Test
    @DisplayName("Should store and read back every field")
    void testSetAndGet() {
        store.set(running("photos", "2024-01-02T10:00:00.000000Z", "42", 500).toBuilder()
                .rowsFailed(3).lastError("boom").build());

        Checkpoint cp = store.get("photos").orElseThrow();
        assertEquals("photos", cp.getTable());
        assertEquals("2024-01-02T10:00:00.000000Z", cp.getLastWatermark());
        assertEquals("42", cp.getLastRowId());
        assertEquals(500, cp.getRowsProcessed());
        assertEquals(3, cp.getRowsFailed());
        assertEquals(CheckpointStatus.RUNNING, cp.getStatus());
        assertEquals("boom", cp.getLastError());
        assertNotNull(cp.getUpdatedAt());
    }

    @Test
    @DisplayName("Should replace a checkpoint as a whole")
    void testSet_Replaces() {
        store.set(running("photos", "2024-01-02T10:00:00.000000Z", "42", 500));
        store.set(Checkpoint.builder().table("photos").lastWatermark("2024-01-03T10:00:00.000000Z")
                .rowsProcessed(700).status(CheckpointStatus.COMPLETED).build());

        Checkpoint cp = store.get("photos").orElseThrow();
        assertEquals("2024-01-03T10:00:00.000000Z", cp.getLastWatermark());
        assertNull(cp.getLastRowId());
        assertEquals(CheckpointStatus.COMPLETED, cp.getStatus());
        assertEquals(1, store.getAll().size());
    }

    @Test
    @DisplayName("Should truncate very long errors")
    void testSet_LongError() {
        store.set(running("photos", null, null, 0).toBuilder().lastError("x".repeat(5000)).build());

        assertEquals(4000, store.get("photos").orElseThrow().getLastError().length());
    }

    @Test
    @DisplayName("Should list by table name and clear one or all")
    void testGetAllAndClear() {
        store.set(running("projects", null, null, 1));
        store.set(running("photos", null, null, 2));
        store.set(running("documents", null, null, 3));

        assertEquals(List.of("documents", "photos", "projects"),
                store.getAll().stream().map(Checkpoint::getTable).toList());

        store.clear("photos");
        assertTrue(store.get("photos").isEmpty());
        assertEquals(2, store.getAll().size());

        store.clearAll();
        assertTrue(store.getAll().isEmpty());
    }

    @Test
    @DisplayName("Should survive a second store opening the same database")
    void testReopen() {
        store.set(running("photos", null, "9", 10));

        JdbcCheckpointStore reopened = new JdbcCheckpointStore(database.dataSource());

        assertEquals("9", reopened.get("photos").orElseThrow().getLastRowId());
    }
}
