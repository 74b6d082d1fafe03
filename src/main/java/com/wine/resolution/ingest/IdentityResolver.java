package com.wine.resolution.ingest;

import com.wine.resolution.catalog.CatalogField;
import com.wine.resolution.catalog.CatalogFilter;
import com.wine.resolution.catalog.CatalogStore;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inserts or updates one normalized catalog record.
 *
 * <p>An existing canonical record is looked up by, in order:</p>
 * <ol>
 *   <li>lwin11</li>
 *   <li>lwin7 and vintage, when the incoming record has both</li>
 *   <li>lwin7 alone</li>
 * </ol>
 * <p>The first hit is updated; otherwise a new record is inserted. Not safe for
 * concurrent upserts of the same identity: callers serialize ingestion.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final CatalogStore store;
    private final Clock clock;

    public IdentityResolver(CatalogStore store) {
        this(store, Clock.systemUTC());
    }

    public IdentityResolver(CatalogStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public UpsertOutcome upsert(CanonicalWineRecord incoming) {
        Instant now = clock.instant();
        Optional<CanonicalWineRecord> existing = findExisting(incoming);

        if (existing.isPresent()) {
            CanonicalWineRecord target = existing.get();
            applyPresentFields(target, incoming);
            target.markSynced(now);
            store.update(target);
            log.debug("upsert.updated id={} lwin7={} lwin11={}", target.getId(), target.getLwin7(), target.getLwin11());
            return UpsertOutcome.updated(target);
        }

        CanonicalWineRecord fresh = incoming.copy();
        fresh.markSynced(now);
        CanonicalWineRecord stored = store.insert(fresh);
        log.debug("upsert.inserted id={} lwin7={} lwin11={}", stored.getId(), stored.getLwin7(), stored.getLwin11());
        return UpsertOutcome.inserted(stored);
    }

    /**
     * Identity lookups in priority order; each is skipped when the incoming record lacks its codes.
     */
    List<CatalogFilter> identityFilters(CanonicalWineRecord incoming) {
        List<CatalogFilter> filters = new ArrayList<>(3);
        if (incoming.getLwin11() != null) {
            filters.add(CatalogFilter.and(
                    CatalogFilter.eq(CatalogField.LWIN11, incoming.getLwin11()),
                    CatalogFilter.canonical()));
        }
        if (incoming.getLwin7() != null && incoming.getVintage() != null) {
            filters.add(CatalogFilter.and(
                    CatalogFilter.eq(CatalogField.LWIN7, incoming.getLwin7()),
                    CatalogFilter.eq(CatalogField.VINTAGE, incoming.getVintage()),
                    CatalogFilter.canonical()));
        }
        if (incoming.getLwin7() != null) {
            filters.add(CatalogFilter.and(
                    CatalogFilter.eq(CatalogField.LWIN7, incoming.getLwin7()),
                    CatalogFilter.canonical()));
        }
        return filters;
    }

    private Optional<CanonicalWineRecord> findExisting(CanonicalWineRecord incoming) {
        for (CatalogFilter filter : identityFilters(incoming)) {
            Optional<CanonicalWineRecord> hit = store.findOne(filter);
            if (hit.isPresent()) {
                log.trace("upsert.lookup.hit filter={}", filter);
                return hit;
            }
        }
        return Optional.empty();
    }

    /**
     * Overwrites every field the incoming record carries. Absent fields leave the target untouched;
     * id and creation time are never copied. An inferred category counts as absent unless the
     * target's category is itself inferred.
     */
    static void applyPresentFields(CanonicalWineRecord target, CanonicalWineRecord incoming) {
        if (present(incoming.getLwin7())) target.setLwin7(incoming.getLwin7());
        if (present(incoming.getLwin11())) target.setLwin11(incoming.getLwin11());
        if (present(incoming.getLwin18())) target.setLwin18(incoming.getLwin18());
        if (present(incoming.getName())) target.setName(incoming.getName());
        if (present(incoming.getProducer())) target.setProducer(incoming.getProducer());
        if (present(incoming.getProducerTitle())) target.setProducerTitle(incoming.getProducerTitle());
        if (incoming.getVintage() != null) target.setVintage(incoming.getVintage());
        if (present(incoming.getCountry())) target.setCountry(incoming.getCountry());
        if (present(incoming.getRegion())) target.setRegion(incoming.getRegion());
        if (present(incoming.getSubRegion())) target.setSubRegion(incoming.getSubRegion());
        if (present(incoming.getAppellation())) target.setAppellation(incoming.getAppellation());
        if (present(incoming.getDesignation())) target.setDesignation(incoming.getDesignation());
        if (present(incoming.getClassification())) target.setClassification(incoming.getClassification());
        // a defaulted category carries no information and never replaces a known one
        if (incoming.getCategory() != null
                && !(incoming.isCategoryInferred() && !target.isCategoryInferred())) {
            target.setCategory(incoming.getCategory(), incoming.isCategoryInferred());
        }
        if (!incoming.getGrapeVarieties().isEmpty()) target.setGrapeVarieties(incoming.getGrapeVarieties());
        if (incoming.getAlcoholContent() != null) target.setAlcoholContent(incoming.getAlcoholContent());
        if (present(incoming.getLwinStatus())) target.setLwinStatus(incoming.getLwinStatus());
        if (present(incoming.getDisplayName())) target.setDisplayName(incoming.getDisplayName());
        if (present(incoming.getSite())) target.setSite(incoming.getSite());
        if (present(incoming.getParcel())) target.setParcel(incoming.getParcel());
        if (present(incoming.getSubType())) target.setSubType(incoming.getSubType());
        if (present(incoming.getVintageConfig())) target.setVintageConfig(incoming.getVintageConfig());
        if (present(incoming.getFirstVintage())) target.setFirstVintage(incoming.getFirstVintage());
        if (present(incoming.getFinalVintage())) target.setFinalVintage(incoming.getFinalVintage());
        if (present(incoming.getLwinReference())) target.setLwinReference(incoming.getLwinReference());
        if (incoming.getLwinDateAdded() != null) target.setLwinDateAdded(incoming.getLwinDateAdded());
        if (incoming.getLwinDateUpdated() != null) target.setLwinDateUpdated(incoming.getLwinDateUpdated());
        if (incoming.getDataSource() != null) target.setDataSource(incoming.getDataSource());
    }

    private static boolean present(String value) {
        return value != null && !value.isEmpty();
    }
}
