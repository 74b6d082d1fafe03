package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;

import java.util.List;
import java.util.Optional;

/**
 * Document-style store holding the wine catalog.
 * Implementations must support field equality, case-insensitive substring match and
 * AND/OR composition as expressed by {@link CatalogFilter}, and must iterate in a stable
 * natural order. Failures surface as {@link CatalogStoreException}.
 */
public interface CatalogStore {

    /**
     * Finds the first record matching the filter.
     */
    Optional<CanonicalWineRecord> findOne(CatalogFilter filter);

    /**
     * Finds up to {@code limit} records matching the filter, in natural order.
     */
    List<CanonicalWineRecord> findMany(CatalogFilter filter, int limit);

    /**
     * Inserts a new record.
     *
     * @return the stored record
     */
    CanonicalWineRecord insert(CanonicalWineRecord record);

    /**
     * Replaces an existing record, matched by id.
     */
    void update(CanonicalWineRecord record);
}
