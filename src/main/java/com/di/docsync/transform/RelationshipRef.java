package com.di.docsync.transform;

/**
 * Navigation link from a record to another document, derived from an inferred relationship.
 */
public record RelationshipRef(String targetDocId, String targetTable, String targetId, String sourceColumn,
                              String relationshipType, String direction, String cardinality) {

    public static final String OUTGOING = "outgoing";
    public static final String INCOMING = "incoming";
}
