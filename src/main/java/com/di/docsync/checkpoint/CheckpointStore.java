package com.di.docsync.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-table progress. Implementations must replace a checkpoint atomically and must not
 * serialize writers of different tables against each other.
 */
public interface CheckpointStore {

    Optional<Checkpoint> get(String table);

    void set(Checkpoint checkpoint);

    List<Checkpoint> getAll();

    /** Removes one table's checkpoint; the next incremental run for it starts from scratch. */
    void clear(String table);

    void clearAll();
}
