package com.wine.resolution.ingest;

/**
 * Callback for tracking catalog import progress.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each batch.
     *
     * @param batchNumber the 1-based batch number just completed
     * @param processed   rows processed so far
     * @param total       rows in the import
     */
    void onBatchCompleted(int batchNumber, long processed, long total);

    ProgressCallback NOOP = (batchNumber, processed, total) -> {};
}
