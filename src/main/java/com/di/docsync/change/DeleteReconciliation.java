package com.di.docsync.change;

import java.util.List;

/**
 * One delete-reconciliation pass over a table.
 *
 * @param sampled number of known ids checked against the source
 * @param absent  ids no longer present in the source
 */
public record DeleteReconciliation(String table, int sampled, List<String> absent) {

    public DeleteReconciliation {
        absent = List.copyOf(absent);
    }

    public static DeleteReconciliation nothingSampled(String table) {
        return new DeleteReconciliation(table, 0, List.of());
    }
}
