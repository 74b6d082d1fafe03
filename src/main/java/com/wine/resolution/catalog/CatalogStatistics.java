package com.wine.resolution.catalog;

import com.wine.resolution.core.model.WineCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of the reference catalog.
 *
 * @param totalRecords total catalog-sourced records
 * @param byCategory   record count per category
 * @param topCountries up to ten countries with the most records, largest first
 */
public record CatalogStatistics(long totalRecords,
                                Map<WineCategory, Long> byCategory,
                                Map<String, Long> topCountries) {

    public CatalogStatistics {
        byCategory = byCategory != null ? Map.copyOf(byCategory) : Map.of();
        topCountries = topCountries != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(topCountries))
                : Map.of();
    }
}
