package com.di.docsync.source;

import java.util.Locale;

/**
 * Serialization family of a declared column type. Covers both PostgreSQL catalog names
 * ({@code int4}, {@code timestamptz}, {@code _text}) and the SQL-standard names the
 * information schema reports ({@code integer}, {@code timestamp with time zone}, {@code array}).
 */
public enum ColumnKind {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TIMESTAMP,
    TIMESTAMP_TZ,
    DATE,
    TIME,
    JSON,
    ARRAY,
    UUID,
    TEXT,
    BINARY,
    OTHER;

    public static ColumnKind fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return OTHER;
        }
        String t = declaredType.trim().toLowerCase(Locale.ROOT);
        if (t.startsWith("_") || t.endsWith("[]") || t.equals("array") || t.endsWith(" array")) {
            return ARRAY;
        }
        switch (t) {
            case "integer", "int", "int2", "int4", "int8", "smallint", "bigint", "tinyint",
                    "serial", "bigserial", "smallserial", "oid" -> {
                return INTEGER;
            }
            case "numeric", "decimal", "real", "float", "float4", "float8", "double", "double precision",
                    "decfloat", "money" -> {
                return DECIMAL;
            }
            case "boolean", "bool", "bit" -> {
                return BOOLEAN;
            }
            case "timestamp with time zone", "timestamptz" -> {
                return TIMESTAMP_TZ;
            }
            case "date" -> {
                return DATE;
            }
            case "json", "jsonb" -> {
                return JSON;
            }
            case "uuid" -> {
                return UUID;
            }
            case "text", "varchar", "character varying", "character", "char", "bpchar", "citext", "name",
                    "character large object", "clob", "varchar_ignorecase" -> {
                return TEXT;
            }
            case "bytea", "binary", "varbinary", "binary varying", "binary large object", "blob" -> {
                return BINARY;
            }
            default -> {
                if (t.startsWith("timestamp")) {
                    return t.contains("with time zone") ? TIMESTAMP_TZ : TIMESTAMP;
                }
                if (t.startsWith("time")) {
                    return TIME;
                }
                if (t.startsWith("character") || t.startsWith("varchar") || t.startsWith("char")) {
                    return TEXT;
                }
                if (t.startsWith("numeric") || t.startsWith("decimal")) {
                    return DECIMAL;
                }
                return OTHER;
            }
        }
    }

    public boolean isTimestamp() {
        return this == TIMESTAMP || this == TIMESTAMP_TZ;
    }

    public boolean isStructured() {
        return this == JSON || this == ARRAY;
    }
}
