package com.di.docsync.schema;

import com.di.docsync.source.ColumnKind;

/**
 * Catalog description of one column.
 */
public record Column(String name, String declaredType, boolean nullable, String defaultValue, Integer maxLength) {

    public ColumnKind kind() {
        return ColumnKind.fromDeclaredType(declaredType);
    }
}
