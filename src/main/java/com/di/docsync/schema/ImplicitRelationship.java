package com.di.docsync.schema;

/**
 * Inferred foreign-key-like link. Advisory only: nothing checks that the target row exists.
 */
public record ImplicitRelationship(String sourceTable, String sourceColumn, String targetTable, String targetColumn,
                                   Cardinality cardinality) {

    public enum Cardinality {
        MANY_TO_ONE,
        ONE_TO_MANY;

        public String label() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    public static ImplicitRelationship manyToOne(String sourceTable, String sourceColumn, String targetTable) {
        return new ImplicitRelationship(sourceTable, sourceColumn, targetTable, "id", Cardinality.MANY_TO_ONE);
    }

    /** Column name without its {@code _id} suffix, e.g. {@code project} for {@code project_id}. */
    public String relationshipType() {
        return sourceColumn.endsWith("_id") ? sourceColumn.substring(0, sourceColumn.length() - 3) : sourceColumn;
    }
}
