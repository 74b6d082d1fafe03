package com.wine.resolution.rules;

import com.wine.resolution.core.model.GrapeVariety;
import com.wine.resolution.core.model.WineCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns loosely typed source values into canonical field values.
 * None of the parse methods throw: malformed input yields null (or an empty list).
 */
public class FieldNormalizer {
    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private final List<CategoryRule> categoryRules;

    public FieldNormalizer() {
        this(DefaultCategoryRules.rules());
    }

    public FieldNormalizer(List<CategoryRule> categoryRules) {
        this.categoryRules = List.copyOf(categoryRules);
    }

    /**
     * Returns the trimmed value of the first key present with a non-blank value.
     * Keys are compared exactly; callers list every casing they accept.
     */
    public static String resolveField(Map<String, String> row, List<String> candidateKeys) {
        if (row == null) {
            return null;
        }
        for (String key : candidateKeys) {
            String value = row.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * Classifies a free-text colour/style label, or empty when no rule matches.
     */
    public Optional<WineCategory> classifyCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        for (CategoryRule rule : categoryRules) {
            if (rule.matches(lower)) {
                return Optional.of(rule.category());
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #classifyCategory(String)} but falls back to {@link DefaultCategoryRules#FALLBACK}.
     * The fallback is lossy; use {@code classifyCategory} to tell the two cases apart.
     */
    public WineCategory normalizeCategory(String raw) {
        return classifyCategory(raw).orElseGet(() -> {
            if (raw != null && !raw.isBlank()) {
                log.debug("Unrecognised category '{}', defaulting to {}", raw, DefaultCategoryRules.FALLBACK);
            }
            return DefaultCategoryRules.FALLBACK;
        });
    }

    /**
     * Splits a comma-separated list into trimmed, non-empty grape names.
     */
    public List<GrapeVariety> parseGrapeList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<GrapeVariety> grapes = new ArrayList<>();
        for (String part : raw.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                grapes.add(GrapeVariety.of(name));
            }
        }
        return List.copyOf(grapes);
    }

    /**
     * Accepts only values made entirely of ASCII digits; no partial parsing.
     */
    public Integer parseVintage(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty() || value.length() > 9) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        return Integer.parseInt(value);
    }

    /**
     * Parses "13.5", "13.5%" or " 13.5 % ". Only plain decimals are accepted; anything else yields null.
     */
    public Double parseAlcohol(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.endsWith("%")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        if (!PLAIN_DECIMAL.matcher(value).matches()) {
            log.debug("Ignoring malformed alcohol value '{}'", raw);
            return null;
        }
        double parsed = Double.parseDouble(value);
        return Double.isFinite(parsed) ? parsed : null;
    }
}
