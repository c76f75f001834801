package com.di.docsync.controller;

import com.di.docsync.controller.dto.SchemaDiscoveryResponse;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.schema.SchemaMapRenderer;
import com.di.docsync.schema.Table;
import com.di.docsync.sync.SyncMode;
import com.di.docsync.sync.SyncOrchestrator;
import com.di.docsync.sync.SyncRequest;
import com.di.docsync.sync.SyncResult;
import com.di.docsync.sync.SyncStatus;
import com.di.docsync.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator API: schema discovery and export, full and incremental runs, status and checkpoint resets.
 * Runs are queued and answered with {@code 202}; poll the job for its report.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SyncController {

    private final SyncOrchestrator orchestrator;

    // ------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------

    /**
     * Example: POST /api/schema/discover
     */
    @PostMapping(value = "/schema/discover", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SchemaDiscoveryResponse> discover() {
        SchemaMap map = orchestrator.discoverSchema();
        SchemaMap.FileReferenceSummary files = map.fileReferencesSummary();
        return ResponseEntity.ok(SchemaDiscoveryResponse.builder()
                .source(map.sourceName())
                .discoveredAt(map.discoveredAt())
                .tableCount(map.tables().size())
                .relationshipCount(map.relationships().size())
                .fileReferenceColumnCount(files.totalFileReferenceColumns())
                .tablesWithFiles(files.tablesWithFiles())
                .failedTables(map.tables().stream().filter(Table::hasError).map(Table::name).toList())
                .build());
    }

    @GetMapping(value = "/schema", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> schema() {
        return ResponseEntity.ok(SchemaMapRenderer.toStructured(orchestrator.currentSchema()));
    }

    @GetMapping(value = "/schema/markdown", produces = "text/markdown;charset=UTF-8")
    public ResponseEntity<String> schemaMarkdown() {
        return ResponseEntity.ok(SchemaMapRenderer.toMarkdown(orchestrator.currentSchema()));
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /**
     * Example: POST /api/sync/full  {"include":["photos"],"dryRun":true}
     */
    @PostMapping(value = "/sync/full", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> full(@RequestBody(required = false) SyncRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.submit(SyncMode.FULL, request));
    }

    @PostMapping(value = "/sync/incremental", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> incremental(@RequestBody(required = false) SyncRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.submit(SyncMode.INCREMENTAL, request));
    }

    /**
     * Syncs one table and answers with its report once done.
     * Example: POST /api/sync/tables/photos?full=true
     */
    @PostMapping(value = "/sync/tables/{table}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> syncTable(@PathVariable String table,
                                                @RequestParam(defaultValue = "false") boolean full) {
        InputValidator.validateTableName(table);
        return ResponseEntity.ok(orchestrator.syncTable(table, full));
    }

    // ------------------------------------------------------------------
    // Status and control
    // ------------------------------------------------------------------

    @GetMapping(value = "/sync/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncStatus> status() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }

    @GetMapping(value = "/sync/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SyncResult>> jobs() {
        return ResponseEntity.ok(orchestrator.recentJobs());
    }

    @GetMapping(value = "/sync/jobs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> job(@PathVariable String jobId) {
        return ResponseEntity.ok(orchestrator.getJob(jobId));
    }

    @PostMapping(value = "/sync/jobs/{jobId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SyncResult> cancel(@PathVariable String jobId) {
        return ResponseEntity.ok(orchestrator.cancel(jobId));
    }

    @DeleteMapping("/sync/checkpoints")
    public ResponseEntity<Void> resetAll() {
        log.info("[API] Resetting all checkpoints");
        orchestrator.resetCheckpoints(Optional.empty());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/sync/checkpoints/{table}")
    public ResponseEntity<Void> reset(@PathVariable String table) {
        log.info("[API] Resetting checkpoint for {}", table);
        orchestrator.resetCheckpoints(Optional.of(InputValidator.validateTableName(table)));
        return ResponseEntity.noContent().build();
    }
}
