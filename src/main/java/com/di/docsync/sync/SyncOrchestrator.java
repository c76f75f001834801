package com.di.docsync.sync;

import com.di.docsync.change.ChangeDetector;
import com.di.docsync.checkpoint.Checkpoint;
import com.di.docsync.checkpoint.CheckpointStore;
import com.di.docsync.checkpoint.KnownIdLedger;
import com.di.docsync.config.SyncProperties;
import com.di.docsync.exception.ErrorCategory;
import com.di.docsync.exception.IndexException;
import com.di.docsync.exception.IngestionException;
import com.di.docsync.exception.SourceConnectionException;
import com.di.docsync.exception.UnknownJobException;
import com.di.docsync.files.FileDownloader;
import com.di.docsync.files.FileDownloaderFactory;
import com.di.docsync.index.IndexDocumentMapper;
import com.di.docsync.index.SearchIndexClient;
import com.di.docsync.schema.SchemaDiscoveryService;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.schema.SchemaMapCache;
import com.di.docsync.schema.Table;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.transform.RecordTransformer;
import com.di.docsync.util.MdcPropagation;
import com.di.docsync.util.MetricsCollector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives full and incremental runs across tables and owns their concurrency.
 *
 * <h3>Concurrency model</h3>
 * <pre>
 *   job executor     : one thread, runs submitted jobs one at a time
 *   table workers    : fixed pool of min(tableWorkers, tableCount) per run, one table per task
 *   download workers : the run's {@link FileDownloader} pool, independent of table workers
 * </pre>
 * Within a table batches are sequential. Only one sync run is active at a time; discovery may run alongside.
 *
 * <h3>Failure model</h3>
 * Row and file failures are counted per table. A table failure is recorded and the other tables carry on.
 * A {@link SourceConnectionException} that survived the connection retry policy cancels the remaining work
 * and fails the run.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private static final long RUN_TIMEOUT_HOURS = 12;
    private static final long FOLLOW_UP_TIMEOUT_MINUTES = 30;
    private static final int JOBS_RETAINED = 50;

    private final SourceConnectionManager connectionManager;
    private final SchemaDiscoveryService discoveryService;
    private final SchemaMapCache schemaCache;
    private final CheckpointStore checkpointStore;
    private final KnownIdLedger knownIdLedger;
    private final SearchIndexClient indexClient;
    private final RecordTransformer transformer;
    private final ChangeDetector changeDetector;
    private final IndexDocumentMapper documentMapper;
    private final FileDownloaderFactory downloaderFactory;
    private final SyncProperties properties;
    private final MetricsCollector metricsCollector;

    private final ExecutorService jobExecutor;
    private final AtomicReference<SyncJob> activeJob = new AtomicReference<>();
    private final Map<String, SyncJob> jobs = Collections.synchronizedMap(new LinkedHashMap<String, SyncJob>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, SyncJob> eldest) {
            return size() > JOBS_RETAINED;
        }
    });

    public SyncOrchestrator(SourceConnectionManager connectionManager, SchemaDiscoveryService discoveryService,
                            SchemaMapCache schemaCache, CheckpointStore checkpointStore, KnownIdLedger knownIdLedger,
                            SearchIndexClient indexClient, RecordTransformer transformer, ChangeDetector changeDetector,
                            IndexDocumentMapper documentMapper, FileDownloaderFactory downloaderFactory,
                            SyncProperties properties, MetricsCollector metricsCollector) {
        this.connectionManager = connectionManager;
        this.discoveryService = discoveryService;
        this.schemaCache = schemaCache;
        this.checkpointStore = checkpointStore;
        this.knownIdLedger = knownIdLedger;
        this.indexClient = indexClient;
        this.transformer = transformer;
        this.changeDetector = changeDetector;
        this.documentMapper = documentMapper;
        this.downloaderFactory = downloaderFactory;
        this.properties = properties;
        this.metricsCollector = metricsCollector;
        this.jobExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "docsync-job");
            t.setDaemon(true);
            return t;
        });
    }

    /* ------------------------------------------------------------------ */
    /* Runs                                                                 */
    /* ------------------------------------------------------------------ */

    /** Runs a full sync on the calling thread and returns its report. */
    public SyncResult runFull(SyncRequest request) {
        SyncJob job = register(SyncMode.FULL, request);
        execute(job);
        return job.toResult();
    }

    /** Runs an incremental sync on the calling thread and returns its report. */
    public SyncResult runIncremental(SyncRequest request) {
        SyncJob job = register(SyncMode.INCREMENTAL, request);
        execute(job);
        return job.toResult();
    }

    /**
     * Queues a run on the job thread and returns at once; poll {@link #getJob(String)} for progress.
     */
    public SyncResult submit(SyncMode mode, SyncRequest request) {
        if (mode == SyncMode.SCHEMA_DISCOVERY) {
            throw new IllegalArgumentException("Schema discovery is not a sync run; use discoverSchema()");
        }
        SyncJob job = register(mode, request);
        jobExecutor.execute(() -> execute(job));
        return job.toResult();
    }

    /** Syncs one table on the calling thread, fully or from its checkpoint. */
    public SyncResult syncTable(String table, boolean full) {
        if (currentSchema().table(table).isEmpty()) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        SyncRequest request = SyncRequest.builder().include(List.of(table)).build();
        return full ? runFull(request) : runIncremental(request);
    }

    private SyncJob register(SyncMode mode, SyncRequest request) {
        SyncRequest effective = request == null ? SyncRequest.defaults() : request;
        // Validate patterns before the job exists.
        TableFilter.of(properties.getExcludeTables(), effective.getInclude(), effective.getExclude());
        SyncJob job = new SyncJob(mode, effective);
        if (!activeJob.compareAndSet(null, job)) {
            throw new IllegalStateException("A sync job is already running: " + activeJob.get().getJobId());
        }
        jobs.put(job.getJobId(), job);
        return job;
    }

    private void execute(SyncJob job) {
        MDC.put(MdcPropagation.JOB_ID, job.getJobId());
        try {
            if (job.cancellation().isCancelled()) {
                job.finish(JobStatus.CANCELLED, null);
                return;
            }
            job.markRunning();
            SchemaMap schemaMap = currentSchema();
            SyncRequest request = job.getRequest();
            TableFilter filter = TableFilter.of(properties.getExcludeTables(), request.getInclude(), request.getExclude());
            List<Table> tables = schemaMap.tables().stream().filter(t -> filter.accepts(t.name())).toList();
            log.info("[SYNC] Job {} {} starting: {} of {} table(s), dryRun={}", job.getJobId(), job.getMode(),
                    tables.size(), schemaMap.tables().size(), request.isDryRun());

            FileDownloader downloader = request.isDownloadFiles() && !request.isDryRun()
                    ? downloaderFactory.create().orElse(null)
                    : null;
            SourceConnectionException fatal;
            try {
                if (downloader != null) {
                    job.cancellation().register(downloader::cancel);
                }
                SyncContext ctx = SyncContext.builder()
                        .job(job)
                        .schemaMap(schemaMap)
                        .connectionManager(connectionManager)
                        .checkpointStore(checkpointStore)
                        .knownIdLedger(knownIdLedger)
                        .indexClient(indexClient)
                        .documentMapper(documentMapper)
                        .transformer(transformer)
                        .changeDetector(changeDetector)
                        .fileDownloader(downloader)
                        .metricsCollector(metricsCollector)
                        .batchSize(properties.getBatchSize())
                        .deleteSampleSize(properties.getDeleteSampleSize())
                        .build();
                fatal = runTables(ctx, tables);
                awaitFollowUps(job);
            } finally {
                if (downloader != null) {
                    downloader.close();
                }
            }

            if (fatal != null) {
                job.finish(JobStatus.FAILED, fatal.getMessage());
            } else if (job.cancellation().isCancelled()) {
                job.finish(JobStatus.CANCELLED, null);
            } else {
                job.finish(JobStatus.COMPLETED, null);
            }
        } catch (RuntimeException e) {
            log.error("[SYNC] Job {} aborted [{}]: {}", job.getJobId(), ErrorCategory.categorize(e), e.getMessage(), e);
            job.addError(SyncError.of(null, null, e));
            job.finish(JobStatus.FAILED, e.getMessage());
        } finally {
            SyncResult result = job.toResult();
            log.info("[SYNC] Job {} {}: {} processed, {} failed, {} error(s)", job.getJobId(), result.status(),
                    result.totalRowsProcessed(), result.totalRowsFailed(), result.errors().size());
            if (metricsCollector != null) {
                metricsCollector.recordRun(result.status() == JobStatus.FAILED);
            }
            activeJob.compareAndSet(job, null);
            MDC.remove(MdcPropagation.JOB_ID);
        }
    }

    /**
     * Runs every table on a fixed worker pool and waits for all of them. A failed table does not stop the
     * others; the first lost source connection cancels the run.
     *
     * @return the run-fatal error, or {@code null}
     */
    private SourceConnectionException runTables(SyncContext ctx, List<Table> tables) {
        if (tables.isEmpty()) {
            return null;
        }
        SyncJob job = ctx.getJob();
        tables.forEach(t -> job.progress(t.name()));

        int workers = Math.max(1, Math.min(properties.getTableWorkers(), tables.size()));
        AtomicInteger threadIndex = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "docsync-table-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(workers, tf);
        AtomicReference<SourceConnectionException> fatal = new AtomicReference<>();
        TableSynchronizer synchronizer = new TableSynchronizer(ctx);
        List<CompletableFuture<Void>> futures = new ArrayList<>(tables.size());

        for (Table table : tables) {
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(MdcPropagation.wrapRunnable(() ->
                            MdcPropagation.runWith(MdcPropagation.TABLE, table.name(), () -> synchronizer.sync(table))),
                            executor)
                    // keeps allOf() waiting for every table, not just the first failure
                    .exceptionally(ex -> {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        if (cause instanceof SourceConnectionException connectionLost) {
                            if (fatal.compareAndSet(null, connectionLost)) {
                                log.error("[SYNC] Source connection lost while syncing {}; cancelling run: {}",
                                        table.name(), connectionLost.getMessage());
                                job.cancellation().cancel();
                            }
                        } else {
                            log.error("[SYNC] Worker for {} crashed: {}", table.name(), cause.getMessage(), cause);
                            job.progress(table.name()).status(JobStatus.FAILED);
                            job.addError(SyncError.of(table.name(), null, cause));
                        }
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(RUN_TIMEOUT_HOURS, TimeUnit.HOURS);
        } catch (TimeoutException e) {
            job.cancellation().cancel();
            throw new IngestionException("Sync run timed out after " + RUN_TIMEOUT_HOURS + " hours", e);
        } catch (ExecutionException e) {
            throw new IngestionException("Sync run execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancellation().cancel();
            throw new IngestionException("Sync run interrupted", e);
        } finally {
            executor.shutdown();
        }
        return fatal.get();
    }

    private void awaitFollowUps(SyncJob job) {
        List<CompletableFuture<Void>> followUps = job.followUps();
        if (followUps.isEmpty()) {
            return;
        }
        log.info("[FILES] Waiting for {} record(s) with downloads in flight", followUps.size());
        try {
            CompletableFuture.allOf(followUps.toArray(CompletableFuture[]::new))
                    .get(FOLLOW_UP_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        } catch (TimeoutException e) {
            log.warn("[FILES] Downloads still running after {} min; reporting them as pending", FOLLOW_UP_TIMEOUT_MINUTES);
            job.addWarning("Some downloads did not finish before the run ended");
        } catch (ExecutionException e) {
            log.warn("[FILES] Download follow-up failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancellation().cancel();
        }
    }

    /* ------------------------------------------------------------------ */
    /* Schema                                                               */
    /* ------------------------------------------------------------------ */

    /**
     * Rediscovers the source schema, replaces the cached map and, when enabled, indexes the schema documents.
     */
    public SchemaMap discoverSchema() {
        SyncJob job = new SyncJob(SyncMode.SCHEMA_DISCOVERY, SyncRequest.defaults());
        jobs.put(job.getJobId(), job);
        MDC.put(MdcPropagation.JOB_ID, job.getJobId());
        try {
            job.markRunning();
            SchemaMap schemaMap = discoveryService.discover();
            schemaCache.put(schemaMap);
            for (Table table : schemaMap.tables()) {
                if (table.hasError()) {
                    job.addError(new SyncError(table.name(), null, ErrorCategory.SCHEMA_ERROR,
                            table.discoveryError(), Instant.now()));
                }
            }
            if (properties.isIndexSchemaDocuments()) {
                indexSchemaDocuments(schemaMap, job);
            }
            job.finish(JobStatus.COMPLETED, null);
            return schemaMap;
        } catch (RuntimeException e) {
            job.addError(SyncError.of(null, null, e));
            job.finish(JobStatus.FAILED, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MdcPropagation.JOB_ID);
        }
    }

    /** The cached schema map, discovering it first when there is none or it has expired. */
    public SchemaMap currentSchema() {
        return schemaCache.get(discoveryService::discover);
    }

    private void indexSchemaDocuments(SchemaMap schemaMap, SyncJob job) {
        int indexed = 0;
        for (Table table : schemaMap.tables()) {
            String documentId = IndexDocumentMapper.tableDocumentId(table.name());
            try {
                indexClient.upsert(documentId, documentMapper.toTableDocument(schemaMap, table));
                indexed++;
            } catch (IndexException e) {
                log.warn("[INDEX] Schema document {} not indexed: {}", documentId, e.getMessage());
                job.addError(SyncError.of(table.name(), null, e));
            }
        }
        String summaryId = IndexDocumentMapper.schemaDocumentId(schemaMap.sourceName());
        try {
            indexClient.upsert(summaryId, documentMapper.toSchemaDocument(schemaMap));
            indexed++;
        } catch (IndexException e) {
            log.warn("[INDEX] Schema document {} not indexed: {}", summaryId, e.getMessage());
            job.addError(SyncError.of(null, null, e));
        }
        log.info("[INDEX] Indexed {} schema document(s)", indexed);
    }

    /* ------------------------------------------------------------------ */
    /* Status and control                                                   */
    /* ------------------------------------------------------------------ */

    public SyncStatus getStatus() {
        List<Checkpoint> checkpoints = checkpointStore.getAll();
        SyncJob active = activeJob.get();
        return new SyncStatus(checkpoints.size(),
                checkpoints.stream().mapToLong(Checkpoint::getRowsProcessed).sum(),
                checkpoints.stream().mapToLong(Checkpoint::getRowsFailed).sum(),
                active != null ? active.getJobId() : null,
                checkpoints);
    }

    public SyncResult getJob(String jobId) {
        return findJob(jobId).toResult();
    }

    public List<SyncResult> recentJobs() {
        synchronized (jobs) {
            return jobs.values().stream().map(SyncJob::toResult).toList();
        }
    }

    /**
     * Signals the job to stop: open cursors are aborted, the download pool takes no new work and every table
     * stops after its current batch. A terminal job is left as it is.
     */
    public SyncResult cancel(String jobId) {
        SyncJob job = findJob(jobId);
        if (!job.getStatus().isTerminal()) {
            log.info("[SYNC] Cancelling job {}", jobId);
            job.cancellation().cancel();
        }
        return job.toResult();
    }

    /**
     * Forgets progress for one table, or for every table when {@code table} is empty. The next incremental
     * run for it starts from the top, and delete reconciliation forgets its known ids.
     */
    public void resetCheckpoints(Optional<String> table) {
        if (activeJob.get() != null) {
            throw new IllegalStateException("Cannot reset checkpoints while job " + activeJob.get().getJobId() + " runs");
        }
        if (table.isPresent()) {
            checkpointStore.clear(table.get());
            knownIdLedger.clear(table.get());
            log.info("[CHECKPOINT] Cleared checkpoint for {}", table.get());
        } else {
            checkpointStore.clearAll();
            knownIdLedger.clearAll();
            log.info("[CHECKPOINT] Cleared all checkpoints");
        }
    }

    private SyncJob findJob(String jobId) {
        SyncJob job = jobs.get(jobId);
        if (job == null) {
            throw new UnknownJobException(jobId);
        }
        return job;
    }

    @PreDestroy
    public void shutdown() {
        SyncJob active = activeJob.get();
        if (active != null) {
            log.info("[SYNC] Shutting down; cancelling job {}", active.getJobId());
            active.cancellation().cancel();
        }
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.shutdownNow();
        }
    }
}
