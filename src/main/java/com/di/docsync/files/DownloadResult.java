package com.di.docsync.files;

/**
 * Outcome of one download. {@code localPath} and {@code bytes} are set on success;
 * {@code reason} on skip or failure.
 */
public record DownloadResult(String reference, DownloadStatus status, String localPath, long bytes, String reason) {

    public static DownloadResult pending(String reference) {
        return new DownloadResult(reference, DownloadStatus.PENDING, null, 0, null);
    }

    public static DownloadResult success(String reference, String localPath, long bytes) {
        return new DownloadResult(reference, DownloadStatus.SUCCESS, localPath, bytes, null);
    }

    public static DownloadResult skipped(String reference, String reason) {
        return new DownloadResult(reference, DownloadStatus.SKIPPED, null, 0, reason);
    }

    public static DownloadResult failed(String reference, String reason) {
        return new DownloadResult(reference, DownloadStatus.FAILED, null, 0, reason);
    }
}
