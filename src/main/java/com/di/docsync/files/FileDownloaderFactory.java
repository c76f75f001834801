package com.di.docsync.files;

import com.di.docsync.config.FileProperties;
import com.di.docsync.util.MetricsCollector;

import java.util.Optional;

/**
 * Builds one {@link FileDownloader} per sync run, so each run owns and drains its own download pool.
 */
public class FileDownloaderFactory {

    private final FileProperties properties;
    private final ObjectStoreClient urlClient;
    private final ObjectStoreClient keyClient;
    private final MetricsCollector metricsCollector;

    /**
     * @param keyClient {@code null} when no object-store bucket is configured
     */
    public FileDownloaderFactory(FileProperties properties, ObjectStoreClient urlClient, ObjectStoreClient keyClient,
                                 MetricsCollector metricsCollector) {
        this.properties = properties;
        this.urlClient = urlClient;
        this.keyClient = keyClient;
        this.metricsCollector = metricsCollector;
    }

    /** Empty when file downloads are disabled. */
    public Optional<FileDownloader> create() {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new FileDownloader(properties, urlClient, keyClient, metricsCollector));
    }
}
