package com.di.docsync.files;

import com.di.docsync.exception.DownloadException;
import com.di.docsync.exception.ObjectAccessDeniedException;
import com.di.docsync.exception.ObjectNotFoundException;

/**
 * Fetches asset bytes by locator.
 */
public interface ObjectStoreClient {

    /**
     * @param locator pre-authorized URL or object-store key, depending on the implementation
     * @throws ObjectNotFoundException     nothing at that locator
     * @throws ObjectAccessDeniedException access refused
     * @throws DownloadException           any other failure (network, server error)
     */
    byte[] fetch(String locator);
}
