package com.di.docsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Embedded checkpoint database. Bound from {@code docsync.checkpoint.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "docsync.checkpoint")
public class CheckpointProperties {

    /** {@code jdbc} keeps checkpoints in the embedded H2 file; {@code memory} loses them on restart. */
    private String store = "jdbc";

    private String jdbcUrl = "jdbc:h2:file:./data/docsync-checkpoints;DB_CLOSE_ON_EXIT=FALSE";

    private String username = "sa";

    private String password = "";

    private int maximumPoolSize = 4;

    public DbConfigSnapshot toSnapshot() {
        return new DbConfigSnapshot(jdbcUrl, username, password, "org.h2.Driver",
                maximumPoolSize, 1, 600_000, 10_000, 1_800_000, false);
    }
}
