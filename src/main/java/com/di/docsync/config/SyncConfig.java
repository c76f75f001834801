package com.di.docsync.config;

import com.di.docsync.change.ChangeDetector;
import com.di.docsync.checkpoint.KnownIdLedger;
import com.di.docsync.files.FileDownloaderFactory;
import com.di.docsync.files.FileReferenceDetector;
import com.di.docsync.files.GcsObjectStoreClient;
import com.di.docsync.files.PreAuthorizedUrlClient;
import com.di.docsync.index.HttpSearchIndexClient;
import com.di.docsync.index.InMemorySearchIndexClient;
import com.di.docsync.index.IndexDocumentMapper;
import com.di.docsync.index.SearchIndexClient;
import com.di.docsync.schema.SchemaDiscoveryService;
import com.di.docsync.schema.SchemaMapCache;
import com.di.docsync.source.SourceConnectionManager;
import com.di.docsync.transform.RecordTransformer;
import com.di.docsync.util.MetricsCollector;
import com.google.cloud.storage.Storage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Pipeline components. Each is built once here and shared by every run.
 */
@Slf4j
@Configuration
public class SyncConfig {

    @Bean
    public SchemaDiscoveryService schemaDiscoveryService(SourceConnectionManager connectionManager,
                                                         SourceProperties sourceProperties,
                                                         MetricsCollector metricsCollector) {
        return new SchemaDiscoveryService(connectionManager, sourceProperties.getSchema(), sourceProperties.getName(),
                metricsCollector);
    }

    @Bean
    public SchemaMapCache schemaMapCache(SyncProperties syncProperties) {
        return new SchemaMapCache(Duration.ofMinutes(syncProperties.getSchemaCacheTtlMinutes()));
    }

    @Bean
    public RecordTransformer recordTransformer(SyncProperties syncProperties) {
        return new RecordTransformer(syncProperties.getContentColumns(), syncProperties.getPartitionColumn(),
                new FileReferenceDetector(), Clock.systemUTC());
    }

    @Bean
    public ChangeDetector changeDetector(SourceConnectionManager connectionManager, SourceProperties sourceProperties,
                                         KnownIdLedger knownIdLedger) {
        return new ChangeDetector(connectionManager, sourceProperties.getSchema(), knownIdLedger);
    }

    @Bean
    public IndexDocumentMapper indexDocumentMapper(SyncProperties syncProperties) {
        return new IndexDocumentMapper(syncProperties.getTableDescriptions());
    }

    @Bean
    public SearchIndexClient searchIndexClient(IndexProperties indexProperties, RestTemplate restTemplate) {
        if ("http".equalsIgnoreCase(indexProperties.getMode())) {
            log.info("[INDEX] Writing documents to {}", indexProperties.getEndpoint());
            return new HttpSearchIndexClient(restTemplate, indexProperties);
        }
        log.warn("[INDEX] In-memory search index: documents are not persisted");
        return new InMemorySearchIndexClient();
    }

    @Bean
    public FileDownloaderFactory fileDownloaderFactory(FileProperties fileProperties, RestTemplate restTemplate,
                                                       ObjectProvider<Storage> storage,
                                                       MetricsCollector metricsCollector) {
        Storage gcs = storage.getIfAvailable();
        GcsObjectStoreClient keyClient = gcs != null && fileProperties.getBucket() != null
                && !fileProperties.getBucket().isBlank()
                ? new GcsObjectStoreClient(gcs, fileProperties.getBucket())
                : null;
        if (keyClient == null) {
            log.info("[FILES] No object-store bucket configured; only files with a pre-authorized URL are fetched");
        }
        return new FileDownloaderFactory(fileProperties, new PreAuthorizedUrlClient(restTemplate), keyClient,
                metricsCollector);
    }
}
