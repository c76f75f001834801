package com.di.docsync.checkpoint;

import java.util.Collection;
import java.util.List;

/**
 * Row ids that have been indexed per table, with the time each was last confirmed present in the source.
 * Delete reconciliation samples the least recently verified ids from here.
 */
public interface KnownIdLedger {

    /** Records ids as indexed and verified now. */
    void recordIndexed(String table, Collection<String> rowIds);

    /** Up to {@code limit} ids ordered by last verification, oldest first. */
    List<String> sampleLeastRecentlyVerified(String table, int limit);

    void markVerified(String table, Collection<String> rowIds);

    void remove(String table, Collection<String> rowIds);

    long count(String table);

    void clear(String table);

    void clearAll();
}
