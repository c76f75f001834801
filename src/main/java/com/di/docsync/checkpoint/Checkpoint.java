package com.di.docsync.checkpoint;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Per-table sync progress. One per table; replaced as a whole after every completed batch.
 * <p>{@code lastWatermark} is the highest watermark value seen, in ISO-8601 text; {@code lastRowId}
 * is the id of the last row of the last completed batch, used to resume inside a run of rows
 * sharing one watermark value.
 */
@Value
@Builder(toBuilder = true)
public class Checkpoint {

    String table;
    String lastWatermark;
    String lastRowId;
    long rowsProcessed;
    long rowsFailed;
    @Builder.Default
    CheckpointStatus status = CheckpointStatus.IDLE;
    String lastError;
    Instant updatedAt;

    public static Checkpoint idle(String table) {
        return Checkpoint.builder().table(table).updatedAt(Instant.now()).build();
    }
}
