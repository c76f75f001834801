package com.di.docsync.change;

import com.di.docsync.checkpoint.KnownIdLedger;
import com.di.docsync.exception.SchemaException;
import com.di.docsync.schema.Column;
import com.di.docsync.schema.Table;
import com.di.docsync.source.ColumnKind;
import com.di.docsync.source.RowCursor;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.source.SourceRow;
import com.di.docsync.transform.ValueSerializer;
import com.di.docsync.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Opens the row stream for one table and reconciles deletes.
 * <p>Every scan is ordered by {@code (watermark, id)}, so any checkpoint position is meaningful to both full
 * and incremental runs. An incremental scan returns exactly the rows whose watermark is strictly greater
 * than the checkpoint's; a scan resuming an interrupted run also takes the rows sharing the checkpoint's
 * watermark whose id sorts after the last completed row. A table without a watermark column is rescanned
 * in full, ordered by id, and the stream carries a warning saying so.
 */
@Slf4j
public class ChangeDetector {

    private static final int ID_PROBE_CHUNK = 500;
    private static final String CREATED_AT = "created_at";

    private final SourceConnectionManager connectionManager;
    private final String schemaName;
    private final KnownIdLedger ledger;

    public ChangeDetector(SourceConnectionManager connectionManager, String schemaName, KnownIdLedger ledger) {
        this.connectionManager = connectionManager;
        this.schemaName = InputValidator.validateIdentifier(schemaName, "Schema name");
        this.ledger = ledger;
    }

    /**
     * Rows changed since the position, ascending by watermark then id.
     */
    public ChangeStream changesSince(Table table, ScanPosition position, int batchSize) {
        return open(table, position, batchSize, true);
    }

    /**
     * Every row of the table, resuming from the position when it marks an interrupted run.
     */
    public ChangeStream fullScan(Table table, ScanPosition position, int batchSize) {
        return open(table, position, batchSize, false);
    }

    private ChangeStream open(Table table, ScanPosition position, int batchSize, boolean incremental) {
        String id = idColumn(table);
        String from = qualified(table.name());
        List<Object> params = new ArrayList<>();
        Optional<String> watermarkColumn = table.preferredWatermark();

        if (watermarkColumn.isEmpty()) {
            String where = "";
            if (position.isResume()) {
                where = " WHERE " + q(id) + " > ?";
                params.add(idParam(table, position.lastRowId()));
            }
            String warning = incremental
                    ? "Table " + table.name() + " has no watermark column; incremental sync falls back to a full re-scan"
                    : null;
            if (warning != null) {
                log.warn("[CHANGES] {}", warning);
            }
            String sql = "SELECT * FROM " + from + where + " ORDER BY " + q(id);
            return new ChangeStream(stream(sql, params, batchSize), null, null, true, warning);
        }

        String wm = watermarkColumn.get();
        Instant previous = position.watermark() == null ? null : ValueSerializer.toInstant(position.watermark());
        String where = "";
        if (position.isResume()) {
            if (previous == null) {
                where = " WHERE (" + q(wm) + " IS NOT NULL OR " + q(id) + " > ?)";
                params.add(idParam(table, position.lastRowId()));
            } else {
                where = " WHERE (" + q(wm) + " > ? OR (" + q(wm) + " = ? AND " + q(id) + " > ?))";
                Object bound = watermarkParam(table, wm, previous);
                params.add(bound);
                params.add(bound);
                params.add(idParam(table, position.lastRowId()));
            }
        } else if (incremental && previous != null) {
            where = " WHERE " + q(wm) + " > ?";
            params.add(watermarkParam(table, wm, previous));
        }
        String sql = "SELECT * FROM " + from + where
                + " ORDER BY " + q(wm) + " ASC NULLS FIRST, " + q(id) + " ASC";
        log.info("[CHANGES] {} {} scan by {} from watermark={} lastRowId={}", table.name(),
                incremental ? "incremental" : "full", wm, position.watermark(), position.lastRowId());
        return new ChangeStream(stream(sql, params, batchSize), wm, incremental ? previous : null, false, null);
    }

    private RowCursor stream(String sql, List<Object> params, int batchSize) {
        return connectionManager.stream(sql, params, batchSize);
    }

    // ------------------------------------------------------------------
    // Row inspection
    // ------------------------------------------------------------------

    /**
     * Watermark value of a row, empty when the column is null or unparseable.
     */
    public Optional<Instant> watermarkOf(SourceRow row, String watermarkColumn) {
        if (watermarkColumn == null) {
            return Optional.empty();
        }
        return instantOf(row.get(watermarkColumn));
    }

    /**
     * A row created after the previous watermark is an insert; anything else is an update.
     * Without a previous watermark every row counts as an insert.
     */
    public ChangeType classify(Table table, SourceRow row, Instant previousWatermark) {
        if (previousWatermark == null) {
            return ChangeType.INSERT;
        }
        if (table.column(CREATED_AT).isEmpty()) {
            return ChangeType.UPDATE;
        }
        return instantOf(row.get(CREATED_AT))
                .filter(created -> created.isAfter(previousWatermark))
                .map(created -> ChangeType.INSERT)
                .orElse(ChangeType.UPDATE);
    }

    private static Optional<Instant> instantOf(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ValueSerializer.toInstant(raw));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Delete reconciliation
    // ------------------------------------------------------------------

    /**
     * Checks the least recently verified known ids against the source. Ids still present are marked
     * verified; absent ones are returned and left in the ledger for the caller to remove once the
     * index delete has gone through.
     */
    public DeleteReconciliation detectDeletes(Table table, int sampleSize) {
        String id = idColumn(table);
        List<String> sample = ledger.sampleLeastRecentlyVerified(table.name(), sampleSize);
        if (sample.isEmpty()) {
            return DeleteReconciliation.nothingSampled(table.name());
        }
        Set<String> present = new HashSet<>();
        for (int i = 0; i < sample.size(); i += ID_PROBE_CHUNK) {
            List<String> chunk = sample.subList(i, Math.min(sample.size(), i + ID_PROBE_CHUNK));
            String placeholders = String.join(",", Collections.nCopies(chunk.size(), "?"));
            Object[] args = chunk.stream().map(v -> idParam(table, v)).toArray();
            present.addAll(connectionManager.query(
                    "SELECT " + q(id) + " FROM " + qualified(table.name()) + " WHERE " + q(id) + " IN (" + placeholders + ")",
                    (rs, n) -> rs.getString(1), args));
        }
        List<String> absent = sample.stream().filter(v -> !present.contains(v)).toList();
        ledger.markVerified(table.name(), present);
        log.info("[CHANGES] {} delete check: {} sampled, {} absent from source", table.name(), sample.size(), absent.size());
        return new DeleteReconciliation(table.name(), sample.size(), absent);
    }

    // ------------------------------------------------------------------
    // Parameters
    // ------------------------------------------------------------------

    private static String idColumn(Table table) {
        return table.primaryKey().orElseThrow(() ->
                new SchemaException(table.name(), "Table " + table.name() + " has no id column; it cannot be synced", null));
    }

    /** Binds a stored watermark in the column's own type so the comparison happens in the database. */
    static Object watermarkParam(Table table, String column, Instant watermark) {
        ColumnKind kind = table.column(column).map(Column::kind).orElse(ColumnKind.TIMESTAMP);
        return switch (kind) {
            case TIMESTAMP_TZ -> OffsetDateTime.ofInstant(watermark, ZoneOffset.UTC);
            case DATE -> LocalDate.ofInstant(watermark, ZoneOffset.UTC);
            case TEXT -> ValueSerializer.TIMESTAMP_FORMAT.format(watermark);
            default -> LocalDateTime.ofInstant(watermark, ZoneOffset.UTC);
        };
    }

    /** Binds a stored row id in the id column's type. */
    static Object idParam(Table table, String rowId) {
        ColumnKind kind = table.column(table.primaryKey().orElse(SourceRow.ID_COLUMN))
                .map(Column::kind).orElse(ColumnKind.TEXT);
        try {
            return switch (kind) {
                case INTEGER -> Long.parseLong(rowId);
                case UUID -> UUID.fromString(rowId);
                default -> rowId;
            };
        } catch (IllegalArgumentException e) {
            return rowId;
        }
    }

    private String qualified(String table) {
        return q(schemaName) + "." + q(InputValidator.validateTableName(table));
    }

    private static String q(String identifier) {
        return InputValidator.quote(identifier);
    }
}
