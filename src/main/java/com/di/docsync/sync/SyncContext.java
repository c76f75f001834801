package com.di.docsync.sync;

import com.di.docsync.change.ChangeDetector;
import com.di.docsync.checkpoint.CheckpointStore;
import com.di.docsync.checkpoint.KnownIdLedger;
import com.di.docsync.files.FileDownloader;
import com.di.docsync.index.IndexDocumentMapper;
import com.di.docsync.index.SearchIndexClient;
import com.di.docsync.schema.SchemaMap;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.transform.RecordTransformer;
import com.di.docsync.util.MetricsCollector;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one run works with, built once by the orchestrator and handed to each table worker.
 * The schema map is the snapshot the run started with; rediscovery during the run does not affect it.
 */
@Value
@Builder
public class SyncContext {

    SyncJob job;
    SchemaMap schemaMap;
    SourceConnectionManager connectionManager;
    CheckpointStore checkpointStore;
    KnownIdLedger knownIdLedger;
    SearchIndexClient indexClient;
    IndexDocumentMapper documentMapper;
    RecordTransformer transformer;
    ChangeDetector changeDetector;
    /** {@code null} when downloads are off for this run. */
    FileDownloader fileDownloader;
    MetricsCollector metricsCollector;
    int batchSize;
    int deleteSampleSize;

    public boolean isDryRun() {
        return job.getRequest().isDryRun();
    }

    public boolean isIncremental() {
        return job.getMode() == SyncMode.INCREMENTAL;
    }

    public CancellationToken cancellation() {
        return job.cancellation();
    }
}
