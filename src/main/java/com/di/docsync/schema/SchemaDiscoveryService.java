package com.di.docsync.schema;

import com.di.docsync.exception.SchemaException;
import com.di.docsync.exception.SourceConnectionException;
import com.di.docsync.source.ColumnKind;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.util.InputValidator;
import com.di.docsync.util.MetricsCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Introspects the source catalog and builds a {@link SchemaMap}.
 * <p>Per table: columns, a row-count estimate, watermark candidates and file-reference columns.
 * File-reference columns need both a matching name and a sample of values with the right shape.
 * A table whose introspection fails is kept with an error flag; only a connection failure or a
 * failure to list tables aborts discovery.
 */
@Slf4j
public class SchemaDiscoveryService {

    private static final int SAMPLE_SIZE = 5;

    private static final Pattern DIRECT_KEY_NAME = Pattern.compile("^(.*_)?(s3_key|storage_key|object_key|file_key|key|file_path|storage_path|path)$");
    private static final Pattern URL_NAME = Pattern.compile("^(.*_)?(url|uri|signed_url|download_url)$");
    private static final Pattern MAP_NAME = Pattern.compile("^(.*_)?(s3_keys|keys|attachments|files|file_map|attachment_map|paths)$");

    private final SourceConnectionManager connectionManager;
    private final String schemaName;
    private final String sourceName;
    private final MetricsCollector metricsCollector;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SchemaDiscoveryService(SourceConnectionManager connectionManager, String schemaName, String sourceName,
                                  MetricsCollector metricsCollector) {
        this.connectionManager = connectionManager;
        this.schemaName = InputValidator.validateIdentifier(schemaName, "Schema name");
        this.sourceName = sourceName;
        this.metricsCollector = metricsCollector;
    }

    public SchemaMap discover() {
        long start = System.currentTimeMillis();
        List<String> tableNames = listTables();
        log.info("[SCHEMA] Discovering {} table(s) in schema '{}'", tableNames.size(), schemaName);

        List<Table> tables = new ArrayList<>(tableNames.size());
        for (String name : tableNames) {
            tables.add(discoverTableIsolated(name));
        }
        List<ImplicitRelationship> relationships = RelationshipInference.infer(tables);
        SchemaMap map = new SchemaMap(Instant.now(), sourceName, tables, relationships);

        long duration = System.currentTimeMillis() - start;
        if (metricsCollector != null) {
            metricsCollector.recordSchemaDiscovery(duration);
        }
        long failed = tables.stream().filter(Table::hasError).count();
        log.info("[SCHEMA] Discovered {} table(s) ({} failed), {} relationship(s), {} file-reference column(s) in {} ms",
                tables.size(), failed, relationships.size(),
                map.fileReferencesSummary().totalFileReferenceColumns(), duration);
        return map;
    }

    List<String> listTables() {
        return connectionManager.query("""
                SELECT table_name FROM information_schema.tables
                 WHERE table_schema = ? AND table_type = 'BASE TABLE'
                 ORDER BY table_name
                """, (rs, n) -> rs.getString(1), schemaName);
    }

    private Table discoverTableIsolated(String name) {
        try {
            return discoverTable(name);
        } catch (SourceConnectionException e) {
            throw e;
        } catch (RuntimeException e) {
            SchemaException schemaError = e instanceof SchemaException se ? se
                    : new SchemaException(name, "Introspection failed for table " + name + ": " + e.getMessage(), e);
            log.error("[SCHEMA] {} flagged: {}", name, schemaError.getMessage());
            return Table.failed(name, schemaError.getMessage());
        }
    }

    Table discoverTable(String name) {
        InputValidator.validateTableName(name);
        List<Column> columns = connectionManager.query("""
                SELECT column_name, data_type, is_nullable, column_default, character_maximum_length
                  FROM information_schema.columns
                 WHERE table_schema = ? AND table_name = ?
                 ORDER BY ordinal_position
                """, (rs, n) -> {
                    Object maxLen = rs.getObject("character_maximum_length");
                    return new Column(rs.getString("column_name"), rs.getString("data_type"),
                            "YES".equalsIgnoreCase(rs.getString("is_nullable")), rs.getString("column_default"),
                            maxLen instanceof Number num ? num.intValue() : null);
                }, schemaName, name);
        if (columns.isEmpty()) {
            throw new SchemaException(name, "No columns visible for table " + name, null);
        }
        long rowCount = estimateRowCount(name);
        List<String> watermarks = watermarkCandidates(columns);
        List<FileReferenceColumn> fileRefs = detectFileReferenceColumns(name, columns);
        log.debug("[SCHEMA] {}: {} column(s), ~{} row(s), watermarks={}, fileRefs={}",
                name, columns.size(), rowCount, watermarks, fileRefs.size());
        return new Table(name, rowCount, columns, watermarks, fileRefs, null);
    }

    // ------------------------------------------------------------------
    // Row counts
    // ------------------------------------------------------------------

    private long estimateRowCount(String table) {
        if (connectionManager.isPostgres()) {
            List<Long> estimate = connectionManager.query("""
                    SELECT c.reltuples::bigint FROM pg_class c
                      JOIN pg_namespace n ON n.oid = c.relnamespace
                     WHERE n.nspname = ? AND c.relname = ?
                    """, (rs, n) -> rs.getLong(1), schemaName, table);
            if (!estimate.isEmpty() && estimate.get(0) >= 0) {
                return estimate.get(0);
            }
        }
        Long count = connectionManager.queryForObject(
                "SELECT COUNT(*) FROM " + qualified(table), Long.class);
        return count == null ? 0 : count;
    }

    // ------------------------------------------------------------------
    // Watermarks
    // ------------------------------------------------------------------

    /**
     * Timestamp-typed columns with a change-tracking name, best first: updated/modified, then synced, then created.
     */
    static List<String> watermarkCandidates(List<Column> columns) {
        return columns.stream()
                .filter(c -> c.kind().isTimestamp())
                .filter(c -> watermarkRank(c.name()) < Integer.MAX_VALUE)
                .sorted(Comparator.comparingInt((Column c) -> watermarkRank(c.name())).thenComparing(Column::name))
                .map(Column::name)
                .toList();
    }

    private static int watermarkRank(String column) {
        String c = column.toLowerCase(Locale.ROOT);
        if (c.equals("updated_at")) return 0;
        if (c.contains("updated") || c.contains("modified") || c.contains("changed")) return 1;
        if (c.equals("last_synced_at") || c.contains("synced")) return 2;
        if (c.equals("created_at")) return 3;
        if (c.contains("created")) return 4;
        return Integer.MAX_VALUE;
    }

    // ------------------------------------------------------------------
    // File references
    // ------------------------------------------------------------------

    private List<FileReferenceColumn> detectFileReferenceColumns(String table, List<Column> columns) {
        List<FileReferenceColumn> result = new ArrayList<>();
        for (Column column : columns) {
            Optional<FileReferenceType> byName = typeByName(column);
            if (byName.isEmpty()) {
                continue;
            }
            List<String> sample = sampleValues(table, column.name());
            if (sampleMatches(byName.get(), sample)) {
                result.add(FileReferenceColumn.of(column.name(), byName.get()));
            } else {
                log.debug("[SCHEMA] {}.{} looks like a {} column by name but its values do not",
                        table, column.name(), byName.get());
            }
        }
        return result;
    }

    static Optional<FileReferenceType> typeByName(Column column) {
        ColumnKind kind = column.kind();
        String name = column.name().toLowerCase(Locale.ROOT);
        if ((kind == ColumnKind.JSON || kind == ColumnKind.TEXT) && MAP_NAME.matcher(name).matches()) {
            return Optional.of(FileReferenceType.KEY_VALUE_MAP);
        }
        if (kind != ColumnKind.TEXT) {
            return Optional.empty();
        }
        if (URL_NAME.matcher(name).matches()) {
            return Optional.of(FileReferenceType.SIGNED_URL);
        }
        if (DIRECT_KEY_NAME.matcher(name).matches()) {
            return Optional.of(FileReferenceType.DIRECT_KEY);
        }
        return Optional.empty();
    }

    private List<String> sampleValues(String table, String column) {
        String col = InputValidator.quote(column);
        return connectionManager.query("SELECT " + col + " FROM " + qualified(table)
                + " WHERE " + col + " IS NOT NULL LIMIT " + SAMPLE_SIZE, (rs, n) -> rs.getString(1));
    }

    /**
     * An empty sample (no non-null values yet) is accepted on the name alone; otherwise every
     * sampled value must have the expected shape.
     */
    boolean sampleMatches(FileReferenceType type, List<String> sample) {
        for (String value : sample) {
            boolean ok = switch (type) {
                case DIRECT_KEY -> FileReferenceType.isPathLike(value);
                case SIGNED_URL -> FileReferenceType.isUrlLike(value);
                case KEY_VALUE_MAP -> isKeyMap(value);
            };
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private boolean isKeyMap(String value) {
        try {
            JsonNode node = objectMapper.readTree(value);
            if (node == null || !node.isObject()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                JsonNode v = fields.next().getValue();
                if (!v.isNull() && !(v.isTextual() && FileReferenceType.isPathLike(v.asText()))) {
                    return false;
                }
            }
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private String qualified(String table) {
        return InputValidator.quote(schemaName) + "." + InputValidator.quote(table);
    }
}
