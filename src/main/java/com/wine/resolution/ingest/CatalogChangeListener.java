package com.wine.resolution.ingest;

/**
 * Notified after ingestion has written to the catalog.
 */
@FunctionalInterface
public interface CatalogChangeListener {

    /**
     * Called once per batch that inserted or updated at least one record.
     *
     * @param inserted records created by the batch
     * @param updated  records overwritten by the batch
     */
    void onCatalogChanged(long inserted, long updated);
}
