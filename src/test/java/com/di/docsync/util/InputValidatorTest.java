package com.di.docsync.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // SQL Identifier Validation Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"users", "photos", "orders", "order_items", "created_by_user", "_private", "t$1", "update_log_x"})
    @DisplayName("Should accept ordinary table names, including ones containing keyword fragments")
    void testValidateTableName_ValidNames(String name) {
        assertEquals(name, InputValidator.validateTableName(name));
    }

    @Test
    @DisplayName("Should trim surrounding whitespace")
    void testValidateTableName_Trims() {
        assertEquals("projects", InputValidator.validateTableName("  projects "));
    }

    @Test
    @DisplayName("Should reject null and empty names")
    void testValidateTableName_NullOrEmpty() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableName(null));
        assertTrue(ex.getMessage().contains("cannot be null"));
        ex = assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTableName("  "));
        assertTrue(ex.getMessage().contains("cannot be empty"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "users; DROP TABLE users--",
            "users' OR '1'='1",
            "users UNION SELECT",
            "users/*comment*/",
            "a\"b"
    })
    @DisplayName("Should reject identifiers with SQL injection patterns")
    void testValidateTableName_SqlInjection(String name) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableName(name));
        assertTrue(ex.getMessage().contains("potentially dangerous"));
    }

    @Test
    @DisplayName("Should reject names over 63 characters")
    void testValidateTableName_TooLong() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableName("a".repeat(64)));
        assertTrue(ex.getMessage().contains("exceeds maximum length"));
    }

    @Test
    @DisplayName("Should reject names starting with a digit or containing dots")
    void testValidateTableName_BadFormat() {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTableName("1photos"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTableName("public.photos"));
    }

    @Test
    @DisplayName("Should double-quote validated identifiers")
    void testQuote() {
        assertEquals("\"updated_at\"", InputValidator.quote("updated_at"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.quote("x; drop"));
    }

    // ============================================================================
    // Table patterns and batch sizes
    // ============================================================================

    @Test
    @DisplayName("Should accept globs and reject anything else")
    void testValidateTablePattern() {
        assertEquals("webhook_*", InputValidator.validateTablePattern("webhook_*"));
        assertEquals("*", InputValidator.validateTablePattern("*"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTablePattern("photo?"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTablePattern(""));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTablePattern(null));
    }

    @Test
    @DisplayName("Should bound batch sizes")
    void testValidateBatchSize() {
        assertEquals(500, InputValidator.validateBatchSize(500));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateBatchSize(100_001));
    }
}
