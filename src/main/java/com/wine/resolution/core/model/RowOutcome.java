package com.wine.resolution.core.model;

/**
 * Per-row result of catalog ingestion.
 */
public enum RowOutcome {
    INSERTED,
    UPDATED,
    SKIPPED,
    FAILED
}
