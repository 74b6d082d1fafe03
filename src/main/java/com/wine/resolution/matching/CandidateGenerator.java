package com.wine.resolution.matching;

import com.wine.resolution.catalog.CatalogField;
import com.wine.resolution.catalog.CatalogFilter;
import com.wine.resolution.catalog.CatalogStore;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Retrieves a bounded set of catalog candidates for an unresolved record.
 *
 * <p>The query is an OR of name, producer and region substring filters, narrowed by country
 * when known and scoped to shared records from the reference catalog. A record that yields
 * no OR branch produces no candidates and no query.</p>
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    public static final int DEFAULT_LIMIT = 100;

    /**
     * Producer-style name prefixes, lower case, each followed by a space.
     */
    static final List<String> NAME_PREFIXES = List.of(
            "château ", "chateau ", "domaine ", "bodegas ", "bodega ", "casa ", "tenuta ", "weingut ");

    private static final int MIN_STRIPPED_NAME_LENGTH = 3;
    private static final int MIN_REGION_LENGTH = 5;

    private final CatalogStore store;

    public CandidateGenerator(CatalogStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public List<CanonicalWineRecord> generate(UnresolvedWineRecord unresolved) {
        return generate(unresolved, DEFAULT_LIMIT);
    }

    public List<CanonicalWineRecord> generate(UnresolvedWineRecord unresolved, int limit) {
        Optional<CatalogFilter> filter = buildFilter(unresolved);
        if (filter.isEmpty()) {
            log.debug("candidates.skipped name='{}' reason=no searchable fields", unresolved.getName());
            return List.of();
        }
        List<CanonicalWineRecord> candidates = store.findMany(filter.get(), limit);
        log.debug("candidates.found count={} filter={}", candidates.size(), filter.get());
        return candidates;
    }

    /**
     * Builds the candidate query, or empty when the record has nothing to search on.
     */
    public Optional<CatalogFilter> buildFilter(UnresolvedWineRecord unresolved) {
        List<CatalogFilter> branches = new ArrayList<>();

        String name = trimToNull(unresolved.getName());
        if (name != null) {
            branches.add(CatalogFilter.containsIgnoreCase(CatalogField.NAME, name));
            stripPrefix(name).ifPresent(stripped ->
                    branches.add(CatalogFilter.containsIgnoreCase(CatalogField.NAME, stripped)));
        }

        String producer = trimToNull(unresolved.getProducer());
        if (producer != null) {
            branches.add(CatalogFilter.containsIgnoreCase(CatalogField.PRODUCER, producer));
            branches.add(CatalogFilter.containsIgnoreCase(CatalogField.PRODUCER_TITLE, producer));
        }

        String region = trimToNull(unresolved.getRegion());
        if (region != null && region.length() >= MIN_REGION_LENGTH) {
            branches.add(CatalogFilter.containsIgnoreCase(CatalogField.REGION, region));
            branches.add(CatalogFilter.containsIgnoreCase(CatalogField.SUB_REGION, region));
        }

        if (branches.isEmpty()) {
            return Optional.empty();
        }

        List<CatalogFilter> clauses = new ArrayList<>(3);
        clauses.add(CatalogFilter.catalogSourced());
        clauses.add(CatalogFilter.or(branches));
        String country = trimToNull(unresolved.getCountry());
        if (country != null) {
            clauses.add(CatalogFilter.containsIgnoreCase(CatalogField.COUNTRY, country));
        }
        return Optional.of(CatalogFilter.and(clauses));
    }

    /**
     * "Château Margaux" becomes "Margaux"; names without a known prefix, or whose remainder is
     * too short, yield empty.
     */
    static Optional<String> stripPrefix(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String prefix : NAME_PREFIXES) {
            if (lower.startsWith(prefix)) {
                String remainder = name.substring(prefix.length()).trim();
                return remainder.length() >= MIN_STRIPPED_NAME_LENGTH ? Optional.of(remainder) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
