package com.di.docsync.checkpoint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Known-id ledger in the embedded H2 database, next to the checkpoints.
 */
@Slf4j
public class JdbcKnownIdLedger implements KnownIdLedger {

    private final JdbcTemplate jdbc;

    public JdbcKnownIdLedger(DataSource dataSource) {
        this.jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS indexed_documents (
              table_name        VARCHAR(255) NOT NULL,
              row_id            VARCHAR(255) NOT NULL,
              last_verified_at  TIMESTAMP WITH TIME ZONE NOT NULL,
              PRIMARY KEY (table_name, row_id)
            )
            """);
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_indexed_documents_verified "
                + "ON indexed_documents (table_name, last_verified_at)");
    }

    @Override
    public void recordIndexed(String table, Collection<String> rowIds) {
        if (rowIds.isEmpty()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        List<Object[]> args = new ArrayList<>(rowIds.size());
        rowIds.forEach(id -> args.add(new Object[]{table, id, now}));
        jdbc.batchUpdate("""
            MERGE INTO indexed_documents (table_name, row_id, last_verified_at)
            KEY (table_name, row_id)
            VALUES (?,?,?)
            """, args);
    }

    @Override
    public List<String> sampleLeastRecentlyVerified(String table, int limit) {
        return jdbc.queryForList("""
            SELECT row_id FROM indexed_documents
             WHERE table_name = ?
             ORDER BY last_verified_at, row_id
             LIMIT ?
            """, String.class, table, limit);
    }

    @Override
    public void markVerified(String table, Collection<String> rowIds) {
        if (rowIds.isEmpty()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        List<Object[]> args = new ArrayList<>(rowIds.size());
        rowIds.forEach(id -> args.add(new Object[]{now, table, id}));
        jdbc.batchUpdate("UPDATE indexed_documents SET last_verified_at = ? WHERE table_name = ? AND row_id = ?", args);
    }

    @Override
    public void remove(String table, Collection<String> rowIds) {
        if (rowIds.isEmpty()) {
            return;
        }
        List<Object[]> args = new ArrayList<>(rowIds.size());
        rowIds.forEach(id -> args.add(new Object[]{table, id}));
        jdbc.batchUpdate("DELETE FROM indexed_documents WHERE table_name = ? AND row_id = ?", args);
        log.debug("[CHECKPOINT] Ledger removed {} id(s) from {}", rowIds.size(), table);
    }

    @Override
    public long count(String table) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM indexed_documents WHERE table_name = ?", Long.class, table);
        return n == null ? 0 : n;
    }

    @Override
    public void clear(String table) {
        jdbc.update("DELETE FROM indexed_documents WHERE table_name = ?", table);
    }

    @Override
    public void clearAll() {
        jdbc.update("DELETE FROM indexed_documents");
    }
}
