package com.wine.resolution.core.model;

/**
 * Provenance of a wine record.
 */
public enum DataSource {
    /**
     * Imported from the reference identification dataset. Only these records are
     * resolution candidates.
     */
    CATALOG_IMPORT("lwin"),

    /**
     * Produced by label extraction.
     */
    AI_EXTRACTED("ai"),

    /**
     * Entered by hand.
     */
    MANUAL("manual");

    private final String label;

    DataSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
