package com.wine.resolution.cache;

import com.wine.resolution.core.model.UnresolvedWineRecord;

import java.util.Locale;

/**
 * Cache key for a resolution call: every field that influences the outcome,
 * trimmed and lower-cased so that casing noise maps to the same entry.
 */
public record ResolutionKey(String name,
                            String producer,
                            Integer vintage,
                            String country,
                            String region,
                            String appellation,
                            String codes) {

    public static ResolutionKey of(UnresolvedWineRecord record) {
        return new ResolutionKey(
                fold(record.getName()),
                fold(record.getProducer()),
                record.getVintage(),
                fold(record.getCountry()),
                fold(record.getRegion()),
                fold(record.getAppellation()),
                String.join("|",
                        String.valueOf(fold(record.getSuggestedLwin())),
                        String.valueOf(record.getLwin7()),
                        String.valueOf(record.getLwin11()),
                        String.valueOf(record.getLwin18())));
    }

    private static String fold(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
