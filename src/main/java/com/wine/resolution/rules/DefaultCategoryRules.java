package com.wine.resolution.rules;

import com.wine.resolution.core.model.WineCategory;

import java.util.List;

/**
 * Built-in category table for English and French colour/style labels.
 * Order matters: the first matching rule wins, so "red" is tested before "port"
 * and "rosé" before "sparkling".
 */
public final class DefaultCategoryRules {

    /**
     * Category assumed when no rule matches. Records carrying it are flagged as inferred.
     */
    public static final WineCategory FALLBACK = WineCategory.RED;

    private DefaultCategoryRules() {
        // Utility class
    }

    public static List<CategoryRule> rules() {
        return List.of(
                new CategoryRule("red", WineCategory.RED),
                new CategoryRule("rouge", WineCategory.RED),

                new CategoryRule("white", WineCategory.WHITE),
                new CategoryRule("blanc", WineCategory.WHITE),

                new CategoryRule("rosé", WineCategory.ROSE),
                new CategoryRule("rose", WineCategory.ROSE),
                new CategoryRule("pink", WineCategory.ROSE),

                new CategoryRule("sparkling", WineCategory.SPARKLING),
                new CategoryRule("champagne", WineCategory.SPARKLING),
                new CategoryRule("pétillant", WineCategory.SPARKLING),

                new CategoryRule("dessert", WineCategory.DESSERT),
                new CategoryRule("sweet", WineCategory.DESSERT),
                new CategoryRule("doux", WineCategory.DESSERT),

                new CategoryRule("fortified", WineCategory.FORTIFIED),
                new CategoryRule("port", WineCategory.FORTIFIED),
                new CategoryRule("sherry", WineCategory.FORTIFIED)
        );
    }
}
