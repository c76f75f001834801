package com.di.docsync.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sync orchestration settings. Bound from {@code docsync.sync.*}.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "docsync.sync")
public class SyncProperties {

    /** Rows per batch; bounds cursor memory, in-flight upserts and checkpoint granularity. */
    @Min(1)
    private int batchSize = 500;

    /** Tables processed concurrently. */
    @Min(1)
    private int tableWorkers = 4;

    /** Glob patterns ({@code *} wildcard) of tables never synced. */
    private List<String> excludeTables = new ArrayList<>(List.of("_prisma_migrations", "sync_events", "webhook_*"));

    /** Ordered searchable-text columns per table. Tables missing here fall back to string columns. */
    private Map<String, List<String>> contentColumns = new LinkedHashMap<>();

    /** Human description per table, carried into every indexed document of that table. */
    private Map<String, String> tableDescriptions = new LinkedHashMap<>();

    /** Known ids checked per table per delete-reconciliation pass. */
    @Min(1)
    private int deleteSampleSize = 1000;

    /** How long a discovered schema map is reused before rediscovery. */
    @Min(1)
    private long schemaCacheTtlMinutes = 60;

    /** Column carrying the owning project; copied into the record's partition key. */
    private String partitionColumn = "project_id";

    /** Index one {@code table:<name>} document per table and a {@code schema:<source>} summary after discovery. */
    private boolean indexSchemaDocuments = true;
}
