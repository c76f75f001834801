package com.di.docsync.change;

import com.di.docsync.source.RowCursor;
import com.di.docsync.source.SourceRow;

import java.time.Instant;
import java.util.List;

/**
 * Rows of one table in scan order, with what the orchestrator needs to checkpoint them.
 * <p>Closing the stream returns the cursor's connection to the pool.
 */
public final class ChangeStream implements AutoCloseable {

    private final RowCursor cursor;
    private final String watermarkColumn;
    private final Instant previousWatermark;
    private final boolean fullRescan;
    private final String warning;

    ChangeStream(RowCursor cursor, String watermarkColumn, Instant previousWatermark, boolean fullRescan,
                 String warning) {
        this.cursor = cursor;
        this.watermarkColumn = watermarkColumn;
        this.previousWatermark = previousWatermark;
        this.fullRescan = fullRescan;
        this.warning = warning;
    }

    public List<SourceRow> nextBatch(int max) {
        return cursor.nextBatch(max);
    }

    public void cancel() {
        cursor.cancel();
    }

    public boolean isCancelled() {
        return cursor.isCancelled();
    }

    /** Column the scan is ordered by, {@code null} for tables without one. */
    public String watermarkColumn() {
        return watermarkColumn;
    }

    /** Watermark the scan started above, {@code null} when it starts from the top. */
    public Instant previousWatermark() {
        return previousWatermark;
    }

    /** True when the table has no watermark column and is rescanned in full every time. */
    public boolean isFullRescan() {
        return fullRescan;
    }

    /** Operator-facing warning about this scan, {@code null} when there is none. */
    public String warning() {
        return warning;
    }

    @Override
    public void close() {
        cursor.close();
    }
}
