package com.di.docsync.schema;

/**
 * A column that holds file locators, with the parsing strategy to use for it.
 */
public record FileReferenceColumn(String columnName, FileReferenceType referenceType, String validationPattern) {

    public static FileReferenceColumn of(String columnName, FileReferenceType type) {
        return new FileReferenceColumn(columnName, type, type.validationPattern().pattern());
    }
}
