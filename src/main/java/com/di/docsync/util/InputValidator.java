package com.di.docsync.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation for identifiers that end up inside generated SQL.
 * <p>Table and column names come from the catalog or from operator input; both are validated
 * and then double-quoted before they are spliced into a statement. Values are always bound.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation Patterns
    // ============================================================================

    /**
     * Unquoted PostgreSQL identifier: starts with a letter or underscore, then letters, digits,
     * underscores or dollar signs, 63 characters at most.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$");

    /**
     * Whole-word SQL keywords, comment markers, statement terminators and quotes.
     * Word boundaries keep names such as {@code orders} or {@code created_by_user} valid.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b|--|/\\*|\\*/|;|'|\")");

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final int MIN_BATCH_SIZE = 1;
    private static final int MAX_BATCH_SIZE = 100_000;

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /**
     * Validates a table, schema or column name.
     *
     * @param identifier     the identifier
     * @param identifierType used in error messages (e.g. "table name")
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(String.format("%s exceeds maximum length of %d characters: %s",
                    identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(String.format(
                    "Invalid %s: contains potentially dangerous SQL patterns", identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format("Invalid %s format: '%s'. "
                    + "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                    identifierType, trimmed));
        }
        return trimmed;
    }

    public static String validateTableName(String tableName) {
        return validateIdentifier(tableName, "Table name");
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    /**
     * Validates and double-quotes an identifier for use in generated SQL.
     */
    public static String quote(String identifier) {
        return "\"" + validateIdentifier(identifier, "Identifier") + "\"";
    }

    /**
     * Validates a table-name glob ({@code *} as the only wildcard).
     */
    public static String validateTablePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Table pattern cannot be null or empty");
        }
        String trimmed = pattern.trim();
        if (!trimmed.matches("[a-zA-Z0-9_$*]{1,63}")) {
            throw new IllegalArgumentException("Invalid table pattern: '" + trimmed + "'");
        }
        return trimmed;
    }

    // ============================================================================
    // Numeric Input Validation
    // ============================================================================

    public static int validateBatchSize(int batchSize) {
        if (batchSize < MIN_BATCH_SIZE || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Batch size must be between %d and %d, got: %d", MIN_BATCH_SIZE, MAX_BATCH_SIZE, batchSize));
        }
        return batchSize;
    }
}
