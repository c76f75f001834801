package com.di.docsync.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories attached to every recorded sync error and used by the retry policies
 * to decide what is worth another attempt.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Pipeline exceptions are categorized by type first; anything else falls through to the
 * JDBC/network/validation matchers. Wrapped causes are unwrapped before matching.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Source connection error", "Failed to establish or maintain the source database connection"),
    SCHEMA_ERROR("Schema introspection error", "Catalog queries failed for a table"),
    TRANSFORM_ERROR("Transform error", "A row could not be serialized into an ingested record"),
    INDEX_ERROR("Index write error", "The search index rejected a document write"),
    OBJECT_NOT_FOUND("Object not found", "The referenced asset does not exist in the object store"),
    ACCESS_DENIED("Access denied", "The object store refused access to the referenced asset"),
    DOWNLOAD_ERROR("Download error", "Fetching a referenced asset failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or unknown relation"),
    PERMISSION_ERROR("Permission denied", "Insufficient privileges on the source database"),
    DATABASE_ERROR("Database error", "General database operation error"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation failure"),
    SERIALIZATION_ERROR("Serialization error", "JSON encoding or decoding failure"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Categories a retry policy may try again. */
    public boolean isTransient() {
        return this == CONNECTION_ERROR || this == NETWORK_ERROR || this == TIMEOUT_ERROR;
    }

    /** Order matters: first match wins. Subclasses before their parents. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof ObjectNotFoundException, OBJECT_NOT_FOUND);
        MATCHERS.put(t -> t instanceof ObjectAccessDeniedException, ACCESS_DENIED);
        MATCHERS.put(t -> t instanceof SchemaException, SCHEMA_ERROR);
        MATCHERS.put(t -> t instanceof TransformException, TRANSFORM_ERROR);
        MATCHERS.put(t -> t instanceof IndexException, INDEX_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        Throwable cause = exception.getCause();
        if (cause != null && cause != exception) {
            ErrorCategory byCause = categorize(cause);
            if (byCause != APPLICATION_ERROR && byCause != UNKNOWN) {
                return byCause;
            }
        }
        if (exception instanceof SourceConnectionException) {
            return CONNECTION_ERROR;
        }
        if (exception instanceof DownloadException) {
            return DOWNLOAD_ERROR;
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized")) return PERMISSION_ERROR;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "28", PERMISSION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "57", CONNECTION_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof java.net.http.HttpConnectTimeoutException
                || t instanceof org.springframework.web.client.ResourceAccessException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.sql.SQLTimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timed out"));
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof java.time.format.DateTimeParseException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
