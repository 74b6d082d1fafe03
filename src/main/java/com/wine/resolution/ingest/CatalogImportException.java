package com.wine.resolution.ingest;

/**
 * Thrown when an import cannot start or continue because its source is unreadable.
 * Problems with individual rows are reported in {@link ImportResult} instead.
 */
public class CatalogImportException extends RuntimeException {

    public CatalogImportException(String message) {
        super(message);
    }

    public CatalogImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
