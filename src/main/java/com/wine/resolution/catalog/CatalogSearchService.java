package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.LwinCode;
import com.wine.resolution.core.model.WineCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the reference catalog: lookup by identity code, browsing and statistics.
 */
public class CatalogSearchService {
    private static final Logger log = LoggerFactory.getLogger(CatalogSearchService.class);

    private static final int TOP_COUNTRIES = 10;

    private final CatalogStore store;

    public CatalogSearchService(CatalogStore store) {
        this.store = store;
    }

    /**
     * Looks up a shared record by LWIN code. The code length picks the field
     * (7, 11 or 18 digits); any other length finds nothing.
     */
    public Optional<CanonicalWineRecord> findByLwin(String code) {
        Optional<LwinCode> variant = LwinCode.forCode(code);
        if (variant.isEmpty()) {
            log.debug("Ignoring LWIN lookup for code of unsupported length: '{}'", code);
            return Optional.empty();
        }
        CatalogField field = switch (variant.get()) {
            case LWIN7 -> CatalogField.LWIN7;
            case LWIN11 -> CatalogField.LWIN11;
            case LWIN18 -> CatalogField.LWIN18;
        };
        return store.findOne(CatalogFilter.and(
                CatalogFilter.eq(field, code.trim()),
                CatalogFilter.canonical()));
    }

    public List<CanonicalWineRecord> search(CatalogSearchQuery query) {
        List<CatalogFilter> filters = new ArrayList<>();
        filters.add(CatalogFilter.catalogSourced());
        if (hasText(query.getText())) {
            filters.add(CatalogFilter.or(List.of(
                    CatalogFilter.containsIgnoreCase(CatalogField.NAME, query.getText().trim()),
                    CatalogFilter.containsIgnoreCase(CatalogField.PRODUCER, query.getText().trim()))));
        }
        if (hasText(query.getCountry())) {
            filters.add(CatalogFilter.eq(CatalogField.COUNTRY, query.getCountry()));
        }
        if (hasText(query.getRegion())) {
            filters.add(CatalogFilter.eq(CatalogField.REGION, query.getRegion()));
        }
        if (query.getCategory() != null) {
            filters.add(CatalogFilter.eq(CatalogField.CATEGORY, query.getCategory()));
        }
        if (query.getVintage() != null) {
            filters.add(CatalogFilter.eq(CatalogField.VINTAGE, query.getVintage()));
        }

        List<CanonicalWineRecord> page = store.findMany(CatalogFilter.and(filters),
                (int) Math.min((long) query.getSkip() + query.getLimit(), Integer.MAX_VALUE));
        if (page.size() <= query.getSkip()) {
            return List.of();
        }
        return List.copyOf(page.subList(query.getSkip(), page.size()));
    }

    public CatalogStatistics statistics() {
        List<CanonicalWineRecord> all = store.findMany(CatalogFilter.catalogSourced(), Integer.MAX_VALUE);

        Map<WineCategory, Long> byCategory = new EnumMap<>(WineCategory.class);
        Map<String, Long> byCountry = new HashMap<>();
        for (CanonicalWineRecord record : all) {
            byCategory.merge(record.getCategory(), 1L, Long::sum);
            if (hasText(record.getCountry())) {
                byCountry.merge(record.getCountry(), 1L, Long::sum);
            }
        }

        Map<String, Long> topCountries = new LinkedHashMap<>();
        byCountry.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_COUNTRIES)
                .forEach(e -> topCountries.put(e.getKey(), e.getValue()));

        return new CatalogStatistics(all.size(), byCategory, topCountries);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
