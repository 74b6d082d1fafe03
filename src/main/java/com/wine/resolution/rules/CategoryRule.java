package com.wine.resolution.rules;

import com.wine.resolution.core.model.WineCategory;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps free-text category labels containing {@code pattern} to a {@link WineCategory}.
 * Matching is a lower-cased substring test.
 */
public record CategoryRule(String pattern, WineCategory category) {

    public CategoryRule {
        Objects.requireNonNull(category, "category is required");
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        pattern = pattern.toLowerCase(Locale.ROOT);
    }

    /**
     * @param lowerCaseLabel a label already lower-cased with {@link Locale#ROOT}
     */
    public boolean matches(String lowerCaseLabel) {
        return lowerCaseLabel.contains(pattern);
    }
}
