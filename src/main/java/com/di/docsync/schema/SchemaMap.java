package com.di.docsync.schema;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the source catalog plus inferred structure. Replaced as a whole by rediscovery.
 */
public record SchemaMap(Instant discoveredAt, String sourceName, List<Table> tables,
                        List<ImplicitRelationship> relationships) {

    public SchemaMap {
        tables = List.copyOf(tables);
        relationships = List.copyOf(relationships);
    }

    public Optional<Table> table(String name) {
        return tables.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public Map<String, Table> tablesByName() {
        return tables.stream().collect(Collectors.toMap(Table::name, Function.identity()));
    }

    public List<ImplicitRelationship> relationshipsFrom(String table) {
        return relationships.stream().filter(r -> r.sourceTable().equals(table)).toList();
    }

    /** Relationships pointing at {@code table}, i.e. its one-to-many children. */
    public List<ImplicitRelationship> relationshipsTo(String table) {
        return relationships.stream().filter(r -> r.targetTable().equals(table)).toList();
    }

    public FileReferenceSummary fileReferencesSummary() {
        List<String> withFiles = tables.stream()
                .filter(t -> !t.fileReferenceColumns().isEmpty())
                .map(Table::name)
                .toList();
        int total = tables.stream().mapToInt(t -> t.fileReferenceColumns().size()).sum();
        return new FileReferenceSummary(total, withFiles);
    }

    public record FileReferenceSummary(int totalFileReferenceColumns, List<String> tablesWithFiles) {
    }
}
