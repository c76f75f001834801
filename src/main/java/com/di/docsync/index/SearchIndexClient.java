package com.di.docsync.index;

import java.util.Map;

/**
 * Write surface of the downstream search index.
 * <p>{@code upsert} is last-write-wins keyed by document id; {@code delete} of an absent document is a no-op.
 * Both throw {@link com.di.docsync.exception.IndexException} when the index rejects the write.
 */
public interface SearchIndexClient {

    void upsert(String documentId, Map<String, Object> fields);

    void delete(String documentId);
}
