package com.di.docsync.change;

import com.di.docsync.checkpoint.Checkpoint;
import com.di.docsync.checkpoint.CheckpointStatus;

/**
 * Where a table scan starts, read from the table's checkpoint.
 *
 * @param watermark  last watermark recorded, ISO-8601 text, {@code null} when none
 * @param lastRowId  last row of the last completed batch when the previous run stopped mid-table
 */
public record ScanPosition(String watermark, String lastRowId) {

    public static final ScanPosition START = new ScanPosition(null, null);

    /**
     * Position for an incremental run: the watermark is always honoured, the row id only when the
     * previous run did not finish the table.
     */
    public static ScanPosition incremental(Checkpoint checkpoint) {
        if (checkpoint == null) {
            return START;
        }
        return new ScanPosition(checkpoint.getLastWatermark(), interrupted(checkpoint) ? checkpoint.getLastRowId() : null);
    }

    /**
     * Position for a full run: from the top unless the previous run stopped mid-table.
     */
    public static ScanPosition full(Checkpoint checkpoint) {
        if (checkpoint == null || !interrupted(checkpoint)) {
            return START;
        }
        return new ScanPosition(checkpoint.getLastWatermark(), checkpoint.getLastRowId());
    }

    private static boolean interrupted(Checkpoint checkpoint) {
        return checkpoint.getLastRowId() != null
                && (checkpoint.getStatus() == CheckpointStatus.RUNNING || checkpoint.getStatus() == CheckpointStatus.FAILED);
    }

    public boolean isResume() {
        return lastRowId != null;
    }

    public boolean isStart() {
        return watermark == null && lastRowId == null;
    }
}
