package com.di.docsync.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Bounded exponential backoff settings, bound under {@code docsync.*.retry}.
 */
@Data
public class RetrySettings {

    /** Total attempts including the first call. */
    @Min(1)
    private int maxAttempts = 3;

    @Min(0)
    private long initialBackoffMs = 500;

    private double multiplier = 2.0;

    private long maxBackoffMs = 10_000;

    public static RetrySettings of(int maxAttempts, long initialBackoffMs) {
        RetrySettings settings = new RetrySettings();
        settings.setMaxAttempts(maxAttempts);
        settings.setInitialBackoffMs(initialBackoffMs);
        return settings;
    }
}
