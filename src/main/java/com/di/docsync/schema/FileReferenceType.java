package com.di.docsync.schema;

import java.util.regex.Pattern;

/**
 * How a file-reference column stores its locator(s).
 */
public enum FileReferenceType {

    /** One object-store key per cell, e.g. {@code 12/345/photos/9/site.jpg}. */
    DIRECT_KEY("^(?![a-zA-Z][a-zA-Z0-9+.-]*://)[^\\s/][^\\r\\n]*/[^\\r\\n]*[^/\\s]$"),

    /** A pre-authorized http(s) URL. */
    SIGNED_URL("^https?://[^\\s/?#]+([/?#]\\S*)?$"),

    /** A JSON object whose values are object-store keys. */
    KEY_VALUE_MAP("^\\{.*}$");

    private final Pattern validationPattern;

    FileReferenceType(String regex) {
        this.validationPattern = Pattern.compile(regex, Pattern.DOTALL);
    }

    public Pattern validationPattern() {
        return validationPattern;
    }

    /** Shape check for a single locator of this type (for maps: one value of the map). */
    public static boolean isPathLike(String value) {
        return value != null && DIRECT_KEY.validationPattern.matcher(value.trim()).matches();
    }

    public static boolean isUrlLike(String value) {
        return value != null && SIGNED_URL.validationPattern.matcher(value.trim()).matches();
    }
}
