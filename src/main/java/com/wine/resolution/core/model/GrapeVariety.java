package com.wine.resolution.core.model;

/**
 * A grape variety in a wine's composition.
 *
 * @param name       variety name as written by the source
 * @param percentage share of the blend, or null when unknown
 */
public record GrapeVariety(String name, Double percentage) {

    public GrapeVariety {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Grape variety name must not be blank");
        }
        if (percentage != null && (percentage < 0.0 || percentage > 100.0)) {
            throw new IllegalArgumentException("Grape percentage must be between 0 and 100, got " + percentage);
        }
    }

    public static GrapeVariety of(String name) {
        return new GrapeVariety(name, null);
    }
}
