package com.wine.resolution.core.model;

/**
 * Wine category (colour/style) as stored on catalog records.
 */
public enum WineCategory {
    RED("red"),
    WHITE("white"),
    ROSE("rosé"),
    SPARKLING("sparkling"),
    DESSERT("dessert"),
    FORTIFIED("fortified");

    private final String label;

    WineCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
