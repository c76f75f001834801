package com.di.docsync.sync;

import com.di.docsync.change.ChangeDetector;
import com.di.docsync.change.ChangeStream;
import com.di.docsync.change.ChangeType;
import com.di.docsync.change.DeleteReconciliation;
import com.di.docsync.change.ScanPosition;
import com.di.docsync.checkpoint.Checkpoint;
import com.di.docsync.checkpoint.CheckpointStatus;
import com.di.docsync.exception.ErrorCategory;
import com.di.docsync.exception.IndexException;
import com.di.docsync.exception.SchemaException;
import com.di.docsync.exception.SourceConnectionException;
import com.di.docsync.exception.TransformException;
import com.di.docsync.files.DownloadResult;
import com.di.docsync.files.FileDownloader;
import com.di.docsync.schema.Table;
import com.di.docsync.source.SourceRow;
import com.di.docsync.transform.IngestedRecord;
import com.di.docsync.transform.ValueSerializer;
import com.di.docsync.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one table through the pipeline: stream, transform, upsert, record, checkpoint, one batch at a time.
 * <p>Batches are strictly sequential so the checkpoint only moves forward. The checkpoint is written after
 * every batch, never mid-batch, so an interruption costs at most the batch in flight. Row failures are
 * counted and the batch continues; any other failure ends this table only, except a lost source connection,
 * which is rethrown for the orchestrator to fail the run.
 */
@Slf4j
class TableSynchronizer {

    private final SyncContext ctx;
    private final SyncJob job;

    TableSynchronizer(SyncContext ctx) {
        this.ctx = ctx;
        this.job = ctx.getJob();
    }

    void sync(Table table) {
        String name = table.name();
        TableProgress progress = job.progress(name);
        if (ctx.cancellation().isCancelled()) {
            progress.status(JobStatus.CANCELLED);
            return;
        }
        progress.status(JobStatus.RUNNING);

        if (table.hasError()) {
            failTable(progress, new SchemaException(name, "Discovery failed for " + name + ": " + table.discoveryError(), null), null);
            return;
        }
        if (table.primaryKey().isEmpty()) {
            failTable(progress, new SchemaException(name, "Table " + name + " has no id column; skipped", null), null);
            return;
        }

        Optional<Checkpoint> previous = ctx.getCheckpointStore().get(name);
        ScanPosition position = ctx.isIncremental()
                ? ScanPosition.incremental(previous.orElse(null))
                : ScanPosition.full(previous.orElse(null));
        Checkpoint checkpoint = startCheckpoint(name, previous.orElse(null), position);

        try {
            long started = System.currentTimeMillis();
            ChangeDetector detector = ctx.getChangeDetector();
            try (ChangeStream stream = ctx.isIncremental()
                    ? detector.changesSince(table, position, ctx.getBatchSize())
                    : detector.fullScan(table, position, ctx.getBatchSize())) {
                Runnable unregister = ctx.cancellation().register(stream::cancel);
                try {
                    if (stream.warning() != null) {
                        progress.addWarning(stream.warning());
                        job.addWarning(stream.warning());
                    }
                    while (!ctx.cancellation().isCancelled()) {
                        List<SourceRow> batch = stream.nextBatch(ctx.getBatchSize());
                        if (batch.isEmpty()) {
                            break;
                        }
                        checkpoint = processBatch(table, stream, batch, checkpoint, progress);
                    }
                } finally {
                    unregister.run();
                }
            }

            if (ctx.cancellation().isCancelled()) {
                progress.status(JobStatus.CANCELLED);
                log.info("[SYNC] {} cancelled after {} row(s); checkpoint left resumable", name, progress.rowsProcessed());
                return;
            }
            if (ctx.isIncremental() && job.getRequest().isDetectDeletes()) {
                reconcileDeletes(table, progress);
            }
            checkpoint = checkpoint.toBuilder()
                    .status(CheckpointStatus.COMPLETED)
                    .lastError(null)
                    .updatedAt(Instant.now())
                    .build();
            saveCheckpoint(checkpoint);
            progress.status(JobStatus.COMPLETED);
            log.info("[SYNC] {} done: {} processed, {} failed in {} ms", name, progress.rowsProcessed(),
                    progress.rowsFailed(), System.currentTimeMillis() - started);
        } catch (SourceConnectionException e) {
            failTable(progress, e, checkpoint);
            throw e;
        } catch (RuntimeException e) {
            failTable(progress, e, checkpoint);
        }
    }

    // ------------------------------------------------------------------
    // Batches
    // ------------------------------------------------------------------

    private Checkpoint processBatch(Table table, ChangeStream stream, List<SourceRow> batch, Checkpoint checkpoint,
                                    TableProgress progress) {
        long started = System.currentTimeMillis();
        String name = table.name();
        List<IngestedRecord> records = new ArrayList<>(batch.size());
        int failed = 0;

        for (SourceRow row : batch) {
            try {
                IngestedRecord record = ctx.getTransformer().transform(ctx.getSchemaMap(), table, row);
                records.add(record);
                progress.addRelationshipsSkipped(record.skippedRelationships());
                if (ctx.isIncremental() && !stream.isFullRescan()) {
                    ChangeType type = ctx.getChangeDetector().classify(table, row, stream.previousWatermark());
                    if (type == ChangeType.INSERT) {
                        progress.addInsert();
                    } else {
                        progress.addUpdate();
                    }
                }
            } catch (TransformException e) {
                failed++;
                log.warn("[TRANSFORM] {} row {} column {}: {}", name, e.getRowId(), e.getColumn(), e.getMessage());
                job.addError(SyncError.of(name, e.getRowId(), e));
            }
        }

        List<IngestedRecord> indexed = index(name, records);
        failed += records.size() - indexed.size();
        if (!ctx.isDryRun() && !indexed.isEmpty()) {
            ctx.getKnownIdLedger().recordIndexed(name, indexed.stream().map(IngestedRecord::sourceRowId).toList());
        }
        scheduleDownloads(name, indexed, progress);

        String watermark = advance(checkpoint.getLastWatermark(), batch, stream.watermarkColumn());
        Checkpoint next = checkpoint.toBuilder()
                .lastWatermark(watermark)
                .lastRowId(batch.get(batch.size() - 1).idAsString())
                .rowsProcessed(checkpoint.getRowsProcessed() + indexed.size())
                .rowsFailed(checkpoint.getRowsFailed() + failed)
                .status(CheckpointStatus.RUNNING)
                .updatedAt(Instant.now())
                .build();
        saveCheckpoint(next);

        progress.addProcessed(indexed.size());
        progress.addFailed(failed);
        progress.lastWatermark(watermark);
        long duration = System.currentTimeMillis() - started;
        if (ctx.getMetricsCollector() != null) {
            ctx.getMetricsCollector().recordBatch(name, indexed.size(), failed, duration);
        }
        log.debug("[SYNC] {} batch: {} read, {} indexed, {} failed, watermark={} ({} ms)", name, batch.size(),
                indexed.size(), failed, watermark, duration);
        return next;
    }

    /**
     * Upserts every record; the ones the index rejects get one more attempt after the rest of the batch.
     *
     * @return the records that are now in the index
     */
    private List<IngestedRecord> index(String table, List<IngestedRecord> records) {
        List<IngestedRecord> indexed = new ArrayList<>(records.size());
        List<IngestedRecord> rejected = new ArrayList<>();
        for (IngestedRecord record : records) {
            try {
                upsert(record, Map.of());
                indexed.add(record);
            } catch (IndexException e) {
                rejected.add(record);
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("[INDEX] {}: retrying {} rejected upsert(s) once", table, rejected.size());
            for (IngestedRecord record : rejected) {
                try {
                    upsert(record, Map.of());
                    indexed.add(record);
                } catch (IndexException e) {
                    log.warn("[INDEX] {} row {} not indexed: {}", table, record.sourceRowId(), e.getMessage());
                    job.addError(SyncError.of(table, record.sourceRowId(), e));
                }
            }
        }
        return indexed;
    }

    private void upsert(IngestedRecord record, Map<String, DownloadResult> downloads) {
        if (ctx.isDryRun()) {
            return;
        }
        ctx.getIndexClient().upsert(record.documentId(),
                ctx.getDocumentMapper().toDocument(ctx.getSchemaMap(), record, downloads));
    }

    /**
     * Queues the record's files and, once all of them are settled, re-upserts the record with their statuses.
     * The initial upsert never waits for this.
     */
    private void scheduleDownloads(String table, List<IngestedRecord> records, TableProgress progress) {
        FileDownloader downloader = ctx.getFileDownloader();
        if (downloader == null) {
            return;
        }
        for (IngestedRecord record : records) {
            if (record.fileReferences().isEmpty()) {
                continue;
            }
            List<CompletableFuture<DownloadResult>> downloads = record.fileReferences().stream()
                    .map(downloader::submit)
                    .toList();
            CompletableFuture<Void> followUp = CompletableFuture
                    .allOf(downloads.toArray(CompletableFuture[]::new))
                    .thenRun(MdcPropagation.wrapRunnable(() -> {
                        Map<String, DownloadResult> results = new LinkedHashMap<>();
                        for (CompletableFuture<DownloadResult> download : downloads) {
                            DownloadResult result = download.join();
                            results.put(result.reference(), result);
                            progress.recordFile(result);
                        }
                        upsert(record, results);
                    }))
                    .exceptionally(ex -> {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        log.warn("[FILES] {} row {}: download status update failed: {}", table, record.sourceRowId(),
                                cause.getMessage());
                        job.addError(SyncError.of(table, record.sourceRowId(), cause));
                        return null;
                    });
            job.trackFollowUp(followUp);
        }
    }

    // ------------------------------------------------------------------
    // Deletes
    // ------------------------------------------------------------------

    private void reconcileDeletes(Table table, TableProgress progress) {
        String name = table.name();
        DeleteReconciliation result = ctx.getChangeDetector().detectDeletes(table, ctx.getDeleteSampleSize());
        List<String> deleted = new ArrayList<>(result.absent().size());
        for (String rowId : result.absent()) {
            if (ctx.isDryRun()) {
                deleted.add(rowId);
                continue;
            }
            try {
                ctx.getIndexClient().delete(IngestedRecord.documentId(name, rowId));
                deleted.add(rowId);
            } catch (IndexException e) {
                log.warn("[INDEX] {} row {} delete failed: {}", name, rowId, e.getMessage());
                job.addError(SyncError.of(name, rowId, e));
            }
        }
        if (!ctx.isDryRun() && !deleted.isEmpty()) {
            ctx.getKnownIdLedger().remove(name, deleted);
        }
        progress.addDeletes(deleted.size());
        if (ctx.getMetricsCollector() != null && !deleted.isEmpty()) {
            ctx.getMetricsCollector().recordDeletes(name, deleted.size());
        }
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    private Checkpoint startCheckpoint(String table, Checkpoint previous, ScanPosition position) {
        Checkpoint start;
        if (position.isResume()) {
            log.info("[CHECKPOINT] {} resuming after row {} (watermark {})", table, position.lastRowId(),
                    position.watermark());
            start = previous.toBuilder().status(CheckpointStatus.RUNNING).lastError(null).updatedAt(Instant.now()).build();
        } else {
            start = Checkpoint.builder()
                    .table(table)
                    .lastWatermark(position.watermark())
                    .status(CheckpointStatus.RUNNING)
                    .updatedAt(Instant.now())
                    .build();
        }
        saveCheckpoint(start);
        return start;
    }

    private void saveCheckpoint(Checkpoint checkpoint) {
        if (!ctx.isDryRun()) {
            ctx.getCheckpointStore().set(checkpoint);
        }
    }

    private void failTable(TableProgress progress, RuntimeException error, Checkpoint checkpoint) {
        String table = progress.table();
        progress.status(JobStatus.FAILED);
        job.addError(SyncError.of(table, null, error));
        log.error("[SYNC] {} failed [{}]: {}", table, ErrorCategory.categorize(error), error.getMessage());
        if (checkpoint == null) {
            return;
        }
        try {
            saveCheckpoint(checkpoint.toBuilder()
                    .status(CheckpointStatus.FAILED)
                    .lastError(error.getMessage())
                    .updatedAt(Instant.now())
                    .build());
        } catch (RuntimeException e) {
            log.error("[CHECKPOINT] {} could not record failure: {}", table, e.getMessage());
        }
    }

    /**
     * Highest of the current watermark and every parseable watermark in the batch.
     */
    private String advance(String current, List<SourceRow> batch, String watermarkColumn) {
        if (watermarkColumn == null) {
            return current;
        }
        Instant best = current == null ? null : ValueSerializer.toInstant(current);
        for (SourceRow row : batch) {
            Optional<Instant> value = ctx.getChangeDetector().watermarkOf(row, watermarkColumn);
            if (value.isPresent() && (best == null || value.get().isAfter(best))) {
                best = value.get();
            }
        }
        return best == null ? null : ValueSerializer.TIMESTAMP_FORMAT.format(best);
    }
}
