package com.di.docsync.change;

/**
 * How a changed row relates to the previous watermark.
 */
public enum ChangeType {
    INSERT,
    UPDATE
}
