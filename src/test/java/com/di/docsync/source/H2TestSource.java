package com.di.docsync.source;

import com.di.docsync.config.RetrySettings;
import com.di.docsync.retry.RetryPolicy;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.UUID;

/**
 * Throwaway in-memory H2 database in PostgreSQL mode, standing in for the source in tests.
 */
public final class H2TestSource {

    private final JdbcDataSource dataSource;
    private final JdbcTemplate jdbc;

    private H2TestSource(String name) {
        this.dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        this.jdbc = new JdbcTemplate(dataSource);
    }

    public static H2TestSource create() {
        return new H2TestSource("src_" + UUID.randomUUID().toString().replace("-", ""));
    }

    public H2TestSource execute(String... statements) {
        for (String sql : statements) {
            jdbc.execute(sql);
        }
        return this;
    }

    public JdbcTemplate jdbc() {
        return jdbc;
    }

    public JdbcDataSource dataSource() {
        return dataSource;
    }

    public SourceConnectionManager connectionManager() {
        return new SourceConnectionManager(dataSource, RetryPolicy.transientErrors("test-source", RetrySettings.of(1, 1)),
                0, null);
    }

    public void shutdown() {
        jdbc.execute("SHUTDOWN");
    }
}
