package com.di.docsync.files;

import com.di.docsync.exception.DownloadException;
import com.di.docsync.exception.ObjectAccessDeniedException;
import com.di.docsync.exception.ObjectNotFoundException;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;

/**
 * Fetches an asset by key from a Google Cloud Storage bucket using Application Default Credentials.
 * Used when the row carries a key but no pre-authorized URL.
 */
public class GcsObjectStoreClient implements ObjectStoreClient {

    private final Storage storage;
    private final String bucket;

    public GcsObjectStoreClient(Storage storage, String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("docsync.files.bucket is required for key-based downloads");
        }
        this.storage = storage;
        this.bucket = bucket;
    }

    @Override
    public byte[] fetch(String key) {
        BlobId blobId = BlobId.of(bucket, key);
        try {
            return storage.readAllBytes(blobId);
        } catch (StorageException e) {
            String locator = "gs://" + bucket + "/" + key;
            throw switch (e.getCode()) {
                case 404 -> new ObjectNotFoundException(locator);
                case 401, 403 -> new ObjectAccessDeniedException(locator, e.getMessage());
                default -> new DownloadException("GCS error " + e.getCode() + " reading " + locator
                        + ": " + e.getMessage(), e);
            };
        }
    }
}
