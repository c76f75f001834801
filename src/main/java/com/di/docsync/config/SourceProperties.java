package com.di.docsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Source database connection. The engine only ever reads from it.
 * Bound from {@code docsync.source.*}.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "docsync.source")
public class SourceProperties {

    /** Identifier written into the schema map and the schema summary document. */
    @NotBlank
    private String name = "source";

    @NotBlank
    private String jdbcUrl;

    private String username;

    private String password;

    private String driverClassName = "org.postgresql.Driver";

    /** Schema that discovery enumerates. */
    @NotBlank
    private String schema = "public";

    @Min(1)
    private int maximumPoolSize = 8;

    private int minimumIdle = 1;

    private long idleTimeoutMs = 300_000;

    private long connectionTimeoutMs = 10_000;

    private long maxLifetimeMs = 1_800_000;

    /** Per-statement timeout; 0 disables it. */
    @Min(0)
    private int queryTimeoutSeconds = 0;

    /** Connection-class retry policy (acquire, query start). */
    @Valid
    private RetrySettings retry = new RetrySettings();

    public DbConfigSnapshot toSnapshot() {
        return new DbConfigSnapshot(jdbcUrl, username, password, driverClassName,
                maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs, true);
    }
}
