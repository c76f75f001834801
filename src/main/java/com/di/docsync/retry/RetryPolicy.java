package com.di.docsync.retry;

import com.di.docsync.config.RetrySettings;
import com.di.docsync.exception.ErrorCategory;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded exponential-backoff retry shared by the connection manager and the downloader.
 * <p>A policy is max attempts, a backoff curve and a retryable-error predicate; anything the
 * predicate rejects is rethrown on the first attempt.
 */
@Slf4j
public final class RetryPolicy {

    private final Retry retry;
    private final int maxAttempts;

    private RetryPolicy(Retry retry, int maxAttempts) {
        this.retry = retry;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy of(String name, RetrySettings settings, Predicate<Throwable> retryable) {
        int attempts = Math.max(1, settings.getMaxAttempts());
        long initial = Math.max(1, settings.getInitialBackoffMs());
        long max = Math.max(initial, settings.getMaxBackoffMs());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(attempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initial, Math.max(1.0, settings.getMultiplier()), max))
                .retryOnException(retryable)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("[RETRY] {} attempt {}/{} failed, retrying in {} ms: {}",
                name, event.getNumberOfRetryAttempts(), attempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        return new RetryPolicy(retry, attempts);
    }

    /**
     * Policy that retries connection, network and timeout failures only.
     */
    public static RetryPolicy transientErrors(String name, RetrySettings settings) {
        return of(name, settings, t -> ErrorCategory.categorize(t).isTransient());
    }

    /**
     * Runs the action, retrying per this policy. The last failure is rethrown unchanged.
     */
    public <T> T call(Callable<T> action) throws Exception {
        return retry.executeCallable(action);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String name() {
        return retry.getName();
    }
}
