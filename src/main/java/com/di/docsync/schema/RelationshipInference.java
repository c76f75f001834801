package com.di.docsync.schema;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Infers many-to-one links from {@code <name>_id} columns.
 * <p>The prefix is turned into candidate table names (plural forms first, then the prefix itself,
 * then its singular). The first candidate that names a discovered table wins; when none does the
 * column is dropped without guessing further.
 */
@Slf4j
public final class RelationshipInference {

    private static final String ID_SUFFIX = "_id";

    private RelationshipInference() {
    }

    public static List<ImplicitRelationship> infer(List<Table> tables) {
        Set<String> known = new LinkedHashSet<>();
        for (Table t : tables) {
            if (!t.hasError()) {
                known.add(t.name());
            }
        }
        List<ImplicitRelationship> relationships = new ArrayList<>();
        for (Table table : tables) {
            if (table.hasError()) {
                continue;
            }
            for (Column column : table.columns()) {
                String name = column.name();
                if (!name.endsWith(ID_SUFFIX) || name.length() <= ID_SUFFIX.length()) {
                    continue;
                }
                String target = resolveTarget(name.substring(0, name.length() - ID_SUFFIX.length()), known);
                if (target != null) {
                    relationships.add(ImplicitRelationship.manyToOne(table.name(), name, target));
                } else {
                    log.debug("[SCHEMA] {}.{} has no matching table, not a relationship", table.name(), name);
                }
            }
        }
        return relationships;
    }

    /**
     * First candidate table name for an id-column prefix that exists in {@code known}, or {@code null}.
     */
    static String resolveTarget(String prefix, Set<String> known) {
        for (String candidate : candidateTableNames(prefix)) {
            if (known.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    static List<String> candidateTableNames(String prefix) {
        Set<String> candidates = new LinkedHashSet<>();
        if (prefix.endsWith("y") && prefix.length() > 1 && !isVowel(prefix.charAt(prefix.length() - 2))) {
            candidates.add(prefix.substring(0, prefix.length() - 1) + "ies");
        }
        if (prefix.endsWith("s") || prefix.endsWith("x") || prefix.endsWith("ch") || prefix.endsWith("sh")) {
            candidates.add(prefix + "es");
        }
        candidates.add(prefix + "s");
        candidates.add(prefix);
        if (prefix.endsWith("ies")) {
            candidates.add(prefix.substring(0, prefix.length() - 3) + "y");
        } else if (prefix.endsWith("s") && prefix.length() > 1) {
            candidates.add(prefix.substring(0, prefix.length() - 1));
        }
        return new ArrayList<>(candidates);
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
