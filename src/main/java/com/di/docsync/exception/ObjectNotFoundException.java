package com.di.docsync.exception;

/**
 * The object store has no asset at the given locator. Not retried.
 */
public class ObjectNotFoundException extends DownloadException {

    public ObjectNotFoundException(String locator) {
        super("Object not found: " + locator);
    }
}
