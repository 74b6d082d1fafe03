package com.wine.resolution.core.model;

/**
 * How a resolution call ended.
 */
public enum ResolutionOutcome {
    /**
     * Matched directly through an identity code carried by the input.
     */
    CODE_MATCH,

    /**
     * Best scored candidate reached the acceptance threshold.
     */
    SCORED_MATCH,

    /**
     * Candidates were found but none scored high enough.
     */
    BELOW_THRESHOLD,

    /**
     * No candidate could be generated or the catalog returned none.
     */
    NO_CANDIDATES;

    public boolean isMatch() {
        return this == CODE_MATCH || this == SCORED_MATCH;
    }
}
