package com.di.docsync.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a discovery request: counts plus the tables that could not be introspected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDiscoveryResponse {

    private String source;
    private Instant discoveredAt;
    private int tableCount;
    private int relationshipCount;
    private int fileReferenceColumnCount;
    private List<String> tablesWithFiles;
    private List<String> failedTables;
}
