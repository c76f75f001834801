package com.di.docsync.checkpoint;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryKnownIdLedger implements KnownIdLedger {

    private final ConcurrentMap<String, ConcurrentMap<String, Long>> byTable = new ConcurrentHashMap<>();
    /** Logical clock; strictly increasing so ordering survives same-millisecond writes. */
    private final AtomicLong clock = new AtomicLong();

    @Override
    public void recordIndexed(String table, Collection<String> rowIds) {
        markVerified(table, rowIds);
    }

    @Override
    public List<String> sampleLeastRecentlyVerified(String table, int limit) {
        Map<String, Long> ids = byTable.getOrDefault(table, new ConcurrentHashMap<>());
        return ids.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public void markVerified(String table, Collection<String> rowIds) {
        ConcurrentMap<String, Long> ids = byTable.computeIfAbsent(table, t -> new ConcurrentHashMap<>());
        rowIds.forEach(id -> ids.put(id, clock.incrementAndGet()));
    }

    @Override
    public void remove(String table, Collection<String> rowIds) {
        ConcurrentMap<String, Long> ids = byTable.get(table);
        if (ids != null) {
            rowIds.forEach(ids::remove);
        }
    }

    @Override
    public long count(String table) {
        ConcurrentMap<String, Long> ids = byTable.get(table);
        return ids == null ? 0 : ids.size();
    }

    @Override
    public void clear(String table) {
        byTable.remove(table);
    }

    @Override
    public void clearAll() {
        byTable.clear();
    }
}
