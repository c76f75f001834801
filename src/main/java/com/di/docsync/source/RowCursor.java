package com.di.docsync.source;

import com.di.docsync.exception.ErrorCategory;
import com.di.docsync.exception.IngestionException;
import com.di.docsync.exception.SourceConnectionException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forward-only, non-restartable cursor over a source query.
 * <p>Rows are pulled from the driver {@code fetchSize} at a time, so memory stays bounded by the
 * batch regardless of table size. The cursor owns its connection and returns it to the pool on
 * {@link #close()}. {@link #cancel()} may be called from another thread; after it the cursor
 * reports exhaustion instead of failing.
 */
@Slf4j
public class RowCursor implements Iterator<SourceRow>, AutoCloseable {

    private final Connection connection;
    private final PreparedStatement statement;
    private final ResultSet resultSet;
    private final String description;
    private final String[] columnNames;
    private final ColumnKind[] columnKinds;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private boolean closed;
    private SourceRow lookahead;
    private boolean exhausted;
    private long rowsRead;

    RowCursor(Connection connection, PreparedStatement statement, ResultSet resultSet, String description)
            throws SQLException {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.description = description;
        ResultSetMetaData md = resultSet.getMetaData();
        int n = md.getColumnCount();
        this.columnNames = new String[n];
        this.columnKinds = new ColumnKind[n];
        for (int i = 0; i < n; i++) {
            columnNames[i] = md.getColumnLabel(i + 1).toLowerCase(java.util.Locale.ROOT);
            columnKinds[i] = ColumnKind.fromDeclaredType(md.getColumnTypeName(i + 1));
        }
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (exhausted || closed || cancelled.get()) {
            return false;
        }
        try {
            if (resultSet.next()) {
                lookahead = readRow();
                rowsRead++;
                return true;
            }
            exhausted = true;
            return false;
        } catch (SQLException e) {
            if (cancelled.get()) {
                log.info("[POOL] Cursor cancelled after {} rows: {}", rowsRead, description);
                exhausted = true;
                return false;
            }
            throw translate(e);
        }
    }

    @Override
    public SourceRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Cursor exhausted: " + description);
        }
        SourceRow row = lookahead;
        lookahead = null;
        return row;
    }

    /**
     * Pulls up to {@code max} rows. An empty list means the cursor is exhausted.
     */
    public List<SourceRow> nextBatch(int max) {
        List<SourceRow> batch = new ArrayList<>(Math.min(max, 1024));
        while (batch.size() < max && hasNext()) {
            batch.add(next());
        }
        return batch;
    }

    /**
     * Aborts the running query. Safe to call from any thread, more than once.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true) && !closed) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("[POOL] Statement cancel failed for {}: {}", description, e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long getRowsRead() {
        return rowsRead;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            resultSet.close();
            statement.close();
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("[POOL] Error releasing cursor resources for {}: {}", description, e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("[POOL] Error returning connection to pool: {}", e.getMessage());
            }
        }
    }

    private SourceRow readRow() throws SQLException {
        Map<String, SourceValue> values = new LinkedHashMap<>(columnNames.length * 2);
        for (int i = 0; i < columnNames.length; i++) {
            ColumnKind kind = columnKinds[i];
            values.put(columnNames[i], new SourceValue(kind, readValue(i + 1, kind)));
        }
        return new SourceRow(values);
    }

    private Object readValue(int index, ColumnKind kind) throws SQLException {
        Object value = switch (kind) {
            case TIMESTAMP -> resultSet.getObject(index, LocalDateTime.class);
            case TIMESTAMP_TZ -> resultSet.getObject(index, OffsetDateTime.class);
            case DATE -> resultSet.getObject(index, LocalDate.class);
            case TIME -> resultSet.getObject(index, LocalTime.class);
            case JSON -> resultSet.getString(index);
            case BINARY -> resultSet.getBytes(index);
            case ARRAY -> readArray(index);
            default -> resultSet.getObject(index);
        };
        return resultSet.wasNull() ? null : value;
    }

    private List<Object> readArray(int index) throws SQLException {
        Array array = resultSet.getArray(index);
        if (array == null) {
            return null;
        }
        try {
            Object elements = array.getArray();
            return elements instanceof Object[] objects ? Arrays.asList(objects) : List.of(elements);
        } finally {
            array.free();
        }
    }

    private RuntimeException translate(SQLException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (category.isTransient()) {
            return new SourceConnectionException("Source connection lost while reading " + description, e);
        }
        return new IngestionException("Source read failed for " + description + ": " + e.getMessage(), e);
    }
}
