package com.di.docsync.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of one run. Include and exclude entries are table names or {@code *} globs;
 * the configured default exclusions always apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    @Builder.Default
    private List<String> include = new ArrayList<>();

    @Builder.Default
    private List<String> exclude = new ArrayList<>();

    /** Run the whole pipeline but write nothing: no index writes, downloads or checkpoints. */
    private boolean dryRun;

    @Builder.Default
    private boolean downloadFiles = true;

    /** Incremental runs only: sample known ids and delete the ones gone from the source. */
    private boolean detectDeletes;

    public static SyncRequest defaults() {
        return SyncRequest.builder().build();
    }
}
