package com.di.docsync.checkpoint;

import com.di.docsync.source.H2TestSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KnownIdLedger Tests")
class KnownIdLedgerTest {

    private H2TestSource database;

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.shutdown();
        }
    }

    private void exerciseBasics(KnownIdLedger ledger) {
        ledger.recordIndexed("photos", List.of("1", "2", "3"));
        ledger.recordIndexed("photos", List.of("2"));
        ledger.recordIndexed("projects", List.of("1"));

        assertEquals(3, ledger.count("photos"));
        assertEquals(1, ledger.count("projects"));
        assertEquals(2, ledger.sampleLeastRecentlyVerified("photos", 2).size());

        ledger.remove("photos", List.of("3"));
        assertEquals(2, ledger.count("photos"));
        assertFalse(ledger.sampleLeastRecentlyVerified("photos", 10).contains("3"));

        ledger.clear("photos");
        assertEquals(0, ledger.count("photos"));
        assertEquals(1, ledger.count("projects"));

        ledger.clearAll();
        assertEquals(0, ledger.count("projects"));
        assertTrue(ledger.sampleLeastRecentlyVerified("projects", 10).isEmpty());
    }

    @Test
    @DisplayName("In-memory ledger should record, sample, remove and clear")
    void testInMemory_Basics() {
        exerciseBasics(new InMemoryKnownIdLedger());
    }

    @Test
    @DisplayName("JDBC ledger should record, sample, remove and clear")
    void testJdbc_Basics() {
        database = H2TestSource.create();
        exerciseBasics(new JdbcKnownIdLedger(database.dataSource()));
    }

    @Test
    @DisplayName("Should sample the least recently verified ids first")
    void testSample_Order() {
        InMemoryKnownIdLedger ledger = new InMemoryKnownIdLedger();
        ledger.recordIndexed("photos", List.of("a", "b", "c"));
        ledger.markVerified("photos", List.of("a"));

        assertEquals(List.of("b", "c"), ledger.sampleLeastRecentlyVerified("photos", 2));
        assertEquals(List.of("b", "c", "a"), ledger.sampleLeastRecentlyVerified("photos", 5));
    }

    @Test
    @DisplayName("Should ignore empty id lists")
    void testEmptyLists() {
        database = H2TestSource.create();
        JdbcKnownIdLedger ledger = new JdbcKnownIdLedger(database.dataSource());

        ledger.recordIndexed("photos", List.of());
        ledger.markVerified("photos", List.of());
        ledger.remove("photos", List.of());

        assertEquals(0, ledger.count("photos"));
    }
}
