package com.di.docsync.source;

import com.di.docsync.exception.ErrorCategory;
import com.di.docsync.exception.IngestionException;
import com.di.docsync.exception.SourceConnectionException;
import com.di.docsync.retry.RetryPolicy;
import com.di.docsync.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * The only component that talks to the source database.
 * <p>Hands out read-only pooled connections, runs catalog queries through a {@link JdbcTemplate}
 * and streams table data through {@link RowCursor}s. Connection acquisition and query start are
 * wrapped in the connection {@link RetryPolicy}; a connection-class failure that survives it is
 * rethrown as {@link SourceConnectionException}, which the orchestrator treats as run-fatal.
 */
@Slf4j
public class SourceConnectionManager {

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final RetryPolicy retryPolicy;
    private final int queryTimeoutSeconds;
    private final MetricsCollector metricsCollector;
    private volatile String databaseProduct;

    public SourceConnectionManager(DataSource dataSource, RetryPolicy retryPolicy, int queryTimeoutSeconds,
                                   MetricsCollector metricsCollector) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        this.retryPolicy = retryPolicy;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.metricsCollector = metricsCollector;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Acquires a pooled read-only connection. Callers must close it.
     */
    public Connection acquire() {
        return withRetry("acquire connection", () -> {
            Connection connection = dataSource.getConnection();
            if (!connection.isReadOnly()) {
                connection.setReadOnly(true);
            }
            return connection;
        });
    }

    /**
     * Runs a parameterized query and returns a lazy cursor over its rows.
     *
     * @param sql       statement with {@code ?} placeholders
     * @param params    bound in order
     * @param fetchSize rows fetched per round trip; also the natural batch size
     */
    public RowCursor stream(String sql, List<?> params, int fetchSize) {
        return withRetry("stream query", () -> {
            Connection connection = dataSource.getConnection();
            try {
                connection.setReadOnly(true);
                if (connection.getAutoCommit()) {
                    connection.setAutoCommit(false);
                }
                PreparedStatement statement = connection.prepareStatement(sql,
                        ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
                statement.setFetchSize(fetchSize);
                if (queryTimeoutSeconds > 0) {
                    statement.setQueryTimeout(queryTimeoutSeconds);
                }
                for (int i = 0; i < params.size(); i++) {
                    statement.setObject(i + 1, params.get(i));
                }
                ResultSet resultSet = statement.executeQuery();
                log.debug("[POOL] Cursor opened (fetchSize={}): {}", fetchSize, sql);
                return new RowCursor(connection, statement, resultSet, abbreviate(sql));
            } catch (SQLException | RuntimeException e) {
                closeQuietly(connection);
                throw e;
            }
        });
    }

    /**
     * Runs a small query (catalog and id lookups) and maps every row.
     */
    public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... args) {
        return withRetry("query", () -> jdbcTemplate.query(sql, rowMapper, args));
    }

    public <T> T queryForObject(String sql, Class<T> type, Object... args) {
        return withRetry("query", () -> jdbcTemplate.queryForObject(sql, type, args));
    }

    /**
     * Lower-case database product name, e.g. {@code postgresql} or {@code h2}.
     */
    public String databaseProduct() {
        if (databaseProduct == null) {
            try (Connection connection = acquire()) {
                databaseProduct = connection.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
            } catch (SQLException e) {
                throw new SourceConnectionException("Could not read source database metadata", e);
            }
        }
        return databaseProduct;
    }

    public boolean isPostgres() {
        return databaseProduct().contains("postgres");
    }

    private <T> T withRetry(String operation, java.util.concurrent.Callable<T> action) {
        try {
            return retryPolicy.call(action);
        } catch (SourceConnectionException e) {
            throw e;
        } catch (Exception e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            if (category.isTransient()) {
                if (metricsCollector != null) {
                    metricsCollector.recordConnectionFailure();
                }
                log.error("[POOL] {} failed after {} attempt(s) [{}]: {}", operation, retryPolicy.maxAttempts(),
                        category, e.getMessage());
                throw new SourceConnectionException("Source " + operation + " failed after "
                        + retryPolicy.maxAttempts() + " attempt(s): " + e.getMessage(), e);
            }
            if (e instanceof RuntimeException re) {
                throw re;
            }
            throw new IngestionException("Source " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("[POOL] Ignoring close failure after query error: {}", e.getMessage());
        }
    }

    private static String abbreviate(String sql) {
        String flat = sql.replaceAll("\\s+", " ").trim();
        return flat.length() > 120 ? flat.substring(0, 117) + "..." : flat;
    }
}
