package com.di.docsync.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a Google Cloud Storage client bean backed by
 * Application Default Credentials (ADC).
 *
 * <p>Only present when {@code docsync.files.bucket} is set; it fetches files whose row carries a
 * storage key but no pre-authorized URL.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "docsync.files", name = "bucket")
public class GcsStorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }
}
