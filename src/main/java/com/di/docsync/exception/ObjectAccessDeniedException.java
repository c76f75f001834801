package com.di.docsync.exception;

/**
 * The object store refused access to the locator (expired signature, missing grant). Not retried.
 */
public class ObjectAccessDeniedException extends DownloadException {

    public ObjectAccessDeniedException(String locator, String detail) {
        super("Access denied for " + locator + (detail != null ? ": " + detail : ""));
    }
}
