package com.di.docsync.transform;

import com.di.docsync.files.DetectedFile;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized, index-ready form of one source row.
 * <p>{@code documentId} depends only on table and row id, so re-ingesting a row overwrites its document.
 */
public record IngestedRecord(String documentId, String sourceTable, String sourceRowId, String partitionKey,
                             Map<String, String> fields, List<RelationshipRef> relationships,
                             List<DetectedFile> fileReferences, String contentText, String sourceModifiedAt,
                             Instant ingestedAt, int skippedRelationships) {

    public IngestedRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        relationships = List.copyOf(relationships);
        fileReferences = List.copyOf(fileReferences);
    }

    public static String documentId(String table, String rowId) {
        return table + ":" + rowId;
    }
}
