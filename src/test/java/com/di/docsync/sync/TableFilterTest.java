package com.di.docsync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableFilter Tests")
class TableFilterTest {

    private static final List<String> DEFAULTS = List.of("_prisma_migrations", "sync_events", "webhook_*");

    @Test
    @DisplayName("Should accept every table except the default exclusions")
    void testAccepts_Defaults() {
        TableFilter filter = TableFilter.of(DEFAULTS, List.of(), List.of());

        assertTrue(filter.accepts("photos"));
        assertFalse(filter.accepts("sync_events"));
        assertFalse(filter.accepts("webhook_deliveries"));
        assertTrue(filter.accepts("my_webhook_log"));
    }

    @Test
    @DisplayName("Should restrict to includes and let excludes win")
    void testAccepts_IncludeExclude() {
        TableFilter filter = TableFilter.of(DEFAULTS, List.of("photo*", "projects"), List.of("photo_tags"));

        assertTrue(filter.accepts("photos"));
        assertTrue(filter.accepts("projects"));
        assertFalse(filter.accepts("photo_tags"));
        assertFalse(filter.accepts("documents"));
    }

    @Test
    @DisplayName("Should treat only * as a wildcard")
    void testToRegex() {
        assertTrue(TableFilter.toRegex("a*b*").matcher("a1b2").matches());
        assertTrue(TableFilter.toRegex("*").matcher("anything").matches());
        assertFalse(TableFilter.toRegex("a$b").matcher("ab").matches());
        assertTrue(TableFilter.toRegex("a$b").matcher("a$b").matches());
    }

    @Test
    @DisplayName("Should reject invalid patterns and tolerate null lists")
    void testOf_Validation() {
        assertThrows(IllegalArgumentException.class, () -> TableFilter.of(DEFAULTS, List.of("x;drop"), null));
        assertTrue(TableFilter.of(null, null, null).accepts("sync_events"));
    }
}
