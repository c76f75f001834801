package com.di.docsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DbConfigSnapshot Tests")
class DbConfigSnapshotTest {

    private static DbConfigSnapshot snapshot(String url, int maxPool, int minIdle) {
        return new DbConfigSnapshot(url, "reader", "secret", "org.postgresql.Driver",
                maxPool, minIdle, 300_000L, 10_000L, 1_800_000L, true);
    }

    @Test
    @DisplayName("Should keep all fields")
    void testCreate_AllFields() {
        DbConfigSnapshot config = snapshot("jdbc:postgresql://localhost:5432/app", 8, 1);

        assertEquals("jdbc:postgresql://localhost:5432/app", config.jdbcUrl());
        assertEquals("reader", config.username());
        assertEquals(8, config.maximumPoolSize());
        assertEquals(1, config.minimumIdle());
        assertTrue(config.readOnly());
        assertTrue(config instanceof java.io.Serializable);
    }

    @Test
    @DisplayName("Should compare by value")
    void testEquality() {
        assertEquals(snapshot("jdbc:h2:mem:a", 2, 0), snapshot("jdbc:h2:mem:a", 2, 0));
        assertNotEquals(snapshot("jdbc:h2:mem:a", 2, 0), snapshot("jdbc:h2:mem:b", 2, 0));
    }

    @Test
    @DisplayName("Should reject a missing URL and inconsistent pool sizes")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> snapshot(null, 2, 0));
        assertThrows(IllegalArgumentException.class, () -> snapshot(" ", 2, 0));
        assertThrows(IllegalArgumentException.class, () -> snapshot("jdbc:h2:mem:a", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> snapshot("jdbc:h2:mem:a", 2, 3));
    }
}
