package com.di.docsync.util;

import com.di.docsync.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe pool registry. Each unique database configuration (JDBC URL + username) gets one HikariCP pool.
 * <p>Read-only snapshots (the source database) get read-only connections with auto-commit off, which is
 * what the PostgreSQL driver needs to stream a result set with a fetch size instead of buffering it.
 * Read-write snapshots (the checkpoint store) keep auto-commit on.
 */
@Slf4j
public enum HikariDataSource {

    INSTANCE;

    private final ConcurrentMap<String, DataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Stable, positive pool ids for monitoring. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /**
     * Gets or creates the pool for the given configuration.
     *
     * @param snapshot database configuration snapshot
     * @return pooled DataSource for that url and user
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);

        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
            hikariConfig.setMinimumIdle(Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize()));
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            hikariConfig.setReadOnly(snapshot.readOnly());
            hikariConfig.setAutoCommit(!snapshot.readOnly());
            // Lazy: an unreachable source must not fail startup, only the run that needs it.
            hikariConfig.setInitializationFailTimeout(-1);

            if (snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
                if (snapshot.readOnly()) {
                    hikariConfig.addDataSourceProperty("readOnlyMode", "always");
                }
            }

            String leakThreshold = System.getProperty("HikariCP.leakDetectionThreshold");
            if (leakThreshold != null && !leakThreshold.isEmpty()) {
                try {
                    hikariConfig.setLeakDetectionThreshold(Long.parseLong(leakThreshold));
                } catch (NumberFormatException e) {
                    log.warn("[POOL] Ignoring invalid HikariCP.leakDetectionThreshold={}", leakThreshold);
                }
            }

            hikariConfig.setPoolName("HikariPool-" + poolIdCounter.incrementAndGet() + "-" + generateShortPoolKey(snapshot));

            com.zaxxer.hikari.HikariDataSource newDataSource = new com.zaxxer.hikari.HikariDataSource(hikariConfig);
            log.info("[POOL] Created | url={} | user={} | maxPoolSize={}, minIdle={} | readOnly={}",
                    sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), snapshot.maximumPoolSize(),
                    hikariConfig.getMinimumIdle(), snapshot.readOnly());
            ConnectionPoolLogger.logPoolStats(newDataSource, "created");
            return newDataSource;
        });
    }

    private String generateConnectionKey(DbConfigSnapshot snapshot) {
        // Password deliberately not part of the key.
        return snapshot.jdbcUrl() + "|" + snapshot.username();
    }

    /**
     * Short, readable pool key (host_db_user) for monitoring.
     */
    String generateShortPoolKey(DbConfigSnapshot snapshot) {
        String url = sanitizeUrl(snapshot.jdbcUrl());
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        String part = url;
        int slashSlash = url.indexOf("//");
        if (slashSlash >= 0) {
            part = url.substring(slashSlash + 2);
        } else if (url.startsWith("jdbc:h2:")) {
            part = url.substring("jdbc:h2:".length());
        }
        int slashDb = part.indexOf("/");
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split("[:;]")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    /**
     * Masks passwords embedded in JDBC URLs for logging.
     */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("(?i)password=[^;&]+", "password=***");
    }

    /**
     * Closes and forgets the pool for the given configuration.
     */
    public void closeDataSource(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);
        DataSource dataSource = dataSourceCache.remove(connectionKey);
        if (dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari) {
            hikari.close();
            log.info("[POOL] Closed | url={}", sanitizeUrl(snapshot.jdbcUrl()));
        }
    }

    /**
     * Closes every pool. Called from the Spring shutdown hook.
     */
    public void closeAll() {
        log.info("[POOL] Closing all DataSources (count: {})", dataSourceCache.size());
        dataSourceCache.forEach((key, dataSource) -> {
            if (dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari) {
                try {
                    hikari.close();
                } catch (RuntimeException e) {
                    log.warn("[POOL] Error closing DataSource {}", sanitizeUrl(key), e);
                }
            }
        });
        dataSourceCache.clear();
    }

    public int getActiveConnectionCount() {
        return dataSourceCache.size();
    }
}
