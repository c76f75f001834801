package com.di.docsync.files;

import java.util.Locale;

/**
 * A file reference found in a row.
 *
 * @param key          object-store key, {@code null} for URL-only references
 * @param url          pre-authorized URL from the same row, {@code null} when the row has none
 * @param mapKey       entry key when the reference came from a key/value map column
 * @param declaredSize size the row declares for the asset, if any
 */
public record DetectedFile(String key, String url, String sourceTable, String sourceRowId, String sourceColumn,
                           String mapKey, String filename, Long declaredSize) {

    /** Stable identity of the reference: the key when there is one, else the URL. */
    public String reference() {
        return key != null ? key : url;
    }

    /** Lowercase extension of the filename, {@code null} when it has none. */
    public String fileType() {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public DetectedFile withUrl(String preAuthorizedUrl) {
        return new DetectedFile(key, preAuthorizedUrl, sourceTable, sourceRowId, sourceColumn, mapKey, filename, declaredSize);
    }
}
