package com.di.docsync.config;

import com.di.docsync.checkpoint.CheckpointStore;
import com.di.docsync.checkpoint.InMemoryCheckpointStore;
import com.di.docsync.checkpoint.InMemoryKnownIdLedger;
import com.di.docsync.checkpoint.JdbcCheckpointStore;
import com.di.docsync.checkpoint.JdbcKnownIdLedger;
import com.di.docsync.checkpoint.KnownIdLedger;
import com.di.docsync.retry.RetryPolicy;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.util.ConnectionPoolLogger;
import com.di.docsync.util.HikariDataSource;
import com.di.docsync.util.MetricsCollector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Pools for the source database and the embedded checkpoint database, both held by {@link HikariDataSource}.
 * Neither is exposed as a {@code DataSource} bean; components receive the handle they need.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    static final String MEMORY_STORE = "memory";

    @Bean
    public SourceConnectionManager sourceConnectionManager(SourceProperties properties, MetricsCollector metricsCollector) {
        DataSource dataSource = HikariDataSource.INSTANCE.getOrInit(properties.toSnapshot());
        ConnectionPoolLogger.logPoolStats(dataSource, "source pool created");
        return new SourceConnectionManager(dataSource,
                RetryPolicy.transientErrors("source-connection", properties.getRetry()),
                properties.getQueryTimeoutSeconds(), metricsCollector);
    }

    @Bean
    public CheckpointStore checkpointStore(CheckpointProperties properties) {
        if (MEMORY_STORE.equalsIgnoreCase(properties.getStore())) {
            log.warn("[CHECKPOINT] In-memory checkpoint store: progress is lost on restart");
            return new InMemoryCheckpointStore();
        }
        log.info("[CHECKPOINT] Checkpoints in {}", HikariDataSource.sanitizeUrl(properties.getJdbcUrl()));
        return new JdbcCheckpointStore(HikariDataSource.INSTANCE.getOrInit(properties.toSnapshot()));
    }

    @Bean
    public KnownIdLedger knownIdLedger(CheckpointProperties properties) {
        if (MEMORY_STORE.equalsIgnoreCase(properties.getStore())) {
            return new InMemoryKnownIdLedger();
        }
        return new JdbcKnownIdLedger(HikariDataSource.INSTANCE.getOrInit(properties.toSnapshot()));
    }

    @PreDestroy
    public void closePools() {
        HikariDataSource.INSTANCE.closeAll();
    }
}
