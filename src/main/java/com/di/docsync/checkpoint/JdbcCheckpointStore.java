package com.di.docsync.checkpoint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Checkpoints in the embedded H2 database.
 * <p>Each {@link #set} is one {@code MERGE} in auto-commit mode, so a crash leaves either the old
 * or the new checkpoint, never a mix. H2 locks rows, so writers of different tables do not block.
 */
@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<Checkpoint> ROW_MAPPER = (rs, n) -> {
        OffsetDateTime updated = rs.getObject("updated_at", OffsetDateTime.class);
        return Checkpoint.builder()
                .table(rs.getString("table_name"))
                .lastWatermark(rs.getString("last_watermark"))
                .lastRowId(rs.getString("last_row_id"))
                .rowsProcessed(rs.getLong("rows_processed"))
                .rowsFailed(rs.getLong("rows_failed"))
                .status(CheckpointStatus.valueOf(rs.getString("status")))
                .lastError(rs.getString("last_error"))
                .updatedAt(updated != null ? updated.toInstant() : null)
                .build();
    };

    public JdbcCheckpointStore(DataSource dataSource) {
        this.jdbc = new JdbcTemplate(dataSource);
        initSchema();
    }

    private void initSchema() {
        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS sync_checkpoints (
              table_name      VARCHAR(255) PRIMARY KEY,
              last_watermark  VARCHAR(64),
              last_row_id     VARCHAR(255),
              rows_processed  BIGINT NOT NULL DEFAULT 0,
              rows_failed     BIGINT NOT NULL DEFAULT 0,
              status          VARCHAR(16) NOT NULL,
              last_error      VARCHAR(4000),
              updated_at      TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """);
        log.info("[CHECKPOINT] Store ready");
    }

    // ------------------------------------------------------------------
    // Operations
    // ------------------------------------------------------------------

    @Override
    public Optional<Checkpoint> get(String table) {
        List<Checkpoint> rows = jdbc.query("SELECT * FROM sync_checkpoints WHERE table_name = ?", ROW_MAPPER, table);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void set(Checkpoint checkpoint) {
        String error = checkpoint.getLastError();
        if (error != null && error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        jdbc.update("""
            MERGE INTO sync_checkpoints
              (table_name, last_watermark, last_row_id, rows_processed, rows_failed, status, last_error, updated_at)
            KEY (table_name)
            VALUES (?,?,?,?,?,?,?,?)
            """,
            checkpoint.getTable(), checkpoint.getLastWatermark(), checkpoint.getLastRowId(),
            checkpoint.getRowsProcessed(), checkpoint.getRowsFailed(), checkpoint.getStatus().name(),
            error, OffsetDateTime.ofInstant(Instant.now(), ZoneOffset.UTC));
        log.debug("[CHECKPOINT] {} -> status={}, watermark={}, lastRowId={}, processed={}",
                checkpoint.getTable(), checkpoint.getStatus(), checkpoint.getLastWatermark(),
                checkpoint.getLastRowId(), checkpoint.getRowsProcessed());
    }

    @Override
    public List<Checkpoint> getAll() {
        return jdbc.query("SELECT * FROM sync_checkpoints ORDER BY table_name", ROW_MAPPER);
    }

    @Override
    public void clear(String table) {
        int removed = jdbc.update("DELETE FROM sync_checkpoints WHERE table_name = ?", table);
        log.info("[CHECKPOINT] Cleared {} ({} row)", table, removed);
    }

    @Override
    public void clearAll() {
        int removed = jdbc.update("DELETE FROM sync_checkpoints");
        log.info("[CHECKPOINT] Cleared all ({} rows)", removed);
    }
}
