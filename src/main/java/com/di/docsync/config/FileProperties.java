package com.di.docsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * File reference download settings. Bound from {@code docsync.files.*}.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "docsync.files")
public class FileProperties {

    private boolean enabled = true;

    /** Root directory; files land under {@code <downloadDir>/<table>/<rowId>/<filename>}. */
    @NotBlank
    private String downloadDir = "./data/downloads";

    /** Download pool size, independent of table workers. */
    @Min(1)
    private int downloadWorkers = 4;

    /** Lowercase extensions that are fetched; everything else is skipped. */
    private List<String> supportedExtensions = new ArrayList<>(List.of("pdf", "jpg", "jpeg", "png", "gif", "tiff"));

    /** Declared sizes above this are skipped without fetching. */
    @Positive
    private long maxFileSizeBytes = 100L * 1024 * 1024;

    /** Bucket for key-based fetches when no pre-authorized URL is on the record. */
    private String bucket;

    @Valid
    private RetrySettings retry = RetrySettings.of(3, 1_000);
}
