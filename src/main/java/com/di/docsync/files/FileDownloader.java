package com.di.docsync.files;

import com.di.docsync.config.FileProperties;
import com.di.docsync.exception.ErrorCategory;
import com.di.docsync.exception.DownloadException;
import com.di.docsync.exception.ObjectAccessDeniedException;
import com.di.docsync.exception.ObjectNotFoundException;
import com.di.docsync.retry.RetryPolicy;
import com.di.docsync.util.MdcPropagation;
import com.di.docsync.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Downloads detected files on its own bounded pool, separate from table workers, so a slow
 * object store never stalls metadata ingestion.
 * <p>Skip policy runs before any fetch: an unsupported extension or a declared size over the
 * ceiling yields {@link DownloadStatus#SKIPPED}. The row's pre-authorized URL is preferred; a bare
 * key goes to the credentialed object-store client. Fetch failures are retried with backoff
 * except for not-found and access-denied, then reported as {@link DownloadStatus#FAILED}.
 * <p>One instance serves one sync run. {@link #cancel()} refuses new work and lets in-flight
 * downloads finish; {@link #close()} waits for them.
 */
@Slf4j
public class FileDownloader implements AutoCloseable {

    private static final long DRAIN_TIMEOUT_MINUTES = 30;

    private final Path root;
    private final Set<String> supportedExtensions;
    private final long maxFileSizeBytes;
    private final ObjectStoreClient urlClient;
    private final ObjectStoreClient keyClient;
    private final RetryPolicy retryPolicy;
    private final MetricsCollector metricsCollector;
    private final ExecutorService executor;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    /**
     * @param keyClient may be {@code null} when no bucket is configured; key-only references then fail
     */
    public FileDownloader(FileProperties properties, ObjectStoreClient urlClient, ObjectStoreClient keyClient,
                          MetricsCollector metricsCollector) {
        this.root = Paths.get(properties.getDownloadDir());
        this.supportedExtensions = properties.getSupportedExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
        this.maxFileSizeBytes = properties.getMaxFileSizeBytes();
        this.urlClient = urlClient;
        this.keyClient = keyClient;
        this.retryPolicy = RetryPolicy.of("file-download", properties.getRetry(), retryable());
        this.metricsCollector = metricsCollector;
        AtomicInteger threadIndex = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "docsync-download-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getDownloadWorkers()), tf);
    }

    static Predicate<Throwable> retryable() {
        return t -> !(t instanceof ObjectNotFoundException || t instanceof ObjectAccessDeniedException)
                && (t instanceof DownloadException || ErrorCategory.categorize(t).isTransient());
    }

    /**
     * Queues a download. Never completes exceptionally.
     */
    public CompletableFuture<DownloadResult> submit(DetectedFile file) {
        if (!accepting.get()) {
            return CompletableFuture.completedFuture(DownloadResult.skipped(file.reference(), "run cancelled"));
        }
        try {
            return CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(() -> download(file)), executor)
                    .exceptionally(ex -> {
                        log.error("[FILES] Unexpected failure downloading {}: {}", file.reference(), ex.getMessage());
                        return DownloadResult.failed(file.reference(), ex.getMessage());
                    });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(DownloadResult.skipped(file.reference(), "run cancelled"));
        }
    }

    /**
     * Downloads one file on the calling thread.
     */
    public DownloadResult download(DetectedFile file) {
        String reference = file.reference();
        Optional<DownloadResult> skip = checkSkipPolicy(file);
        if (skip.isPresent()) {
            log.debug("[FILES] Skipped {}: {}", reference, skip.get().reason());
            return record(skip.get());
        }
        ObjectStoreClient client;
        String locator;
        if (file.url() != null) {
            client = urlClient;
            locator = file.url();
        } else if (file.key() != null && keyClient != null) {
            client = keyClient;
            locator = file.key();
        } else {
            return record(DownloadResult.failed(reference,
                    "no pre-authorized URL on the row and no object store configured"));
        }

        byte[] bytes;
        try {
            bytes = retryPolicy.call(() -> client.fetch(locator));
        } catch (ObjectNotFoundException | ObjectAccessDeniedException e) {
            log.warn("[FILES] {} row {} {}: {}", file.sourceTable(), file.sourceRowId(), reference, e.getMessage());
            return record(DownloadResult.failed(reference, e.getMessage()));
        } catch (Exception e) {
            log.warn("[FILES] {} row {} {}: giving up after {} attempt(s): {}", file.sourceTable(),
                    file.sourceRowId(), reference, retryPolicy.maxAttempts(), e.getMessage());
            return record(DownloadResult.failed(reference, ErrorCategory.categorize(e).name() + ": " + e.getMessage()));
        }

        if (bytes.length > maxFileSizeBytes) {
            return record(DownloadResult.skipped(reference, "size " + bytes.length + " exceeds " + maxFileSizeBytes));
        }
        try {
            Path target = targetPath(file);
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".part");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[FILES] Downloaded {} ({} bytes) -> {}", reference, bytes.length, target);
            return record(DownloadResult.success(reference, target.toString(), bytes.length));
        } catch (IOException e) {
            log.warn("[FILES] Could not write {}: {}", reference, e.getMessage());
            return record(DownloadResult.failed(reference, "write failed: " + e.getMessage()));
        }
    }

    /**
     * Skip decision made from the reference alone, before any network call.
     */
    public Optional<DownloadResult> checkSkipPolicy(DetectedFile file) {
        String type = file.fileType();
        if (type != null && !supportedExtensions.contains(type)) {
            return Optional.of(DownloadResult.skipped(file.reference(), "unsupported file type: " + type));
        }
        if (file.declaredSize() != null && file.declaredSize() > maxFileSizeBytes) {
            return Optional.of(DownloadResult.skipped(file.reference(),
                    "declared size " + file.declaredSize() + " exceeds " + maxFileSizeBytes));
        }
        return Optional.empty();
    }

    /**
     * {@code <root>/<table>/<rowId>/<digest>_<filename>}. The digest is taken over the full
     * reference, so two objects on one row that share a filename land in different files.
     */
    Path targetPath(DetectedFile file) {
        String name = file.filename() != null && !file.filename().isBlank() ? file.filename()
                : (file.mapKey() != null ? file.mapKey() : "asset");
        return root.resolve(safe(file.sourceTable())).resolve(safe(file.sourceRowId()))
                .resolve(referenceDigest(file.reference()) + "_" + safe(name));
    }

    static String referenceDigest(String reference) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(String.valueOf(reference).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String safe(String segment) {
        String s = segment == null ? "unknown" : segment.replaceAll("[^A-Za-z0-9._-]", "_");
        return s.isEmpty() || s.equals(".") || s.equals("..") ? "_" : s;
    }

    private DownloadResult record(DownloadResult result) {
        if (metricsCollector != null) {
            metricsCollector.recordFile(result.status().label());
        }
        return result;
    }

    /**
     * Stops accepting downloads. Queued and running downloads still complete.
     */
    public void cancel() {
        if (accepting.compareAndSet(true, false)) {
            log.info("[FILES] Download pool closed to new work");
        }
        executor.shutdown();
    }

    /**
     * Waits for queued and running downloads, then releases the pool.
     */
    @Override
    public void close() {
        accepting.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                log.warn("[FILES] Downloads still running after {} min, abandoning them", DRAIN_TIMEOUT_MINUTES);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
