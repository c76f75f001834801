package com.di.docsync.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP pool statistics.
 * <p>Called at pool creation, at run start and at run end by the orchestrator, so a run's
 * connection footprint (peak active vs. table workers) can be read from the log.
 */
@Slf4j
public final class ConnectionPoolLogger {

    private ConnectionPoolLogger() {}

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource
     * @param phase      when this is being logged (e.g. "created", "run start")
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("[POOL] Stats not available (not HikariCP): phase={}", phase);
            return;
        }
        if (hikari.getHikariPoolMXBean() == null) {
            log.info("[POOL] {} | pool={} | maxSize={} | not started", phase, hikari.getPoolName(), hikari.getMaximumPoolSize());
            return;
        }
        log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                hikari.getHikariPoolMXBean().getActiveConnections(),
                hikari.getHikariPoolMXBean().getIdleConnections(),
                hikari.getHikariPoolMXBean().getTotalConnections(),
                hikari.getHikariPoolMXBean().getThreadsAwaitingConnection());
    }
}
