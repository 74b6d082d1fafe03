package com.wine.resolution.catalog;

/**
 * Runtime exception raised by a {@link CatalogStore} when the underlying store fails
 * (connectivity, timeout, constraint violation). Not retried by this library.
 */
public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
