package com.di.docsync.checkpoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local checkpoints. Used with {@code docsync.checkpoint.store=memory} and in tests.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentMap<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkpoint> get(String table) {
        return Optional.ofNullable(checkpoints.get(table));
    }

    @Override
    public void set(Checkpoint checkpoint) {
        checkpoints.put(checkpoint.getTable(), checkpoint.toBuilder().updatedAt(Instant.now()).build());
    }

    @Override
    public List<Checkpoint> getAll() {
        List<Checkpoint> all = new ArrayList<>(checkpoints.values());
        all.sort(Comparator.comparing(Checkpoint::getTable));
        return all;
    }

    @Override
    public void clear(String table) {
        checkpoints.remove(table);
    }

    @Override
    public void clearAll() {
        checkpoints.clear();
    }
}
