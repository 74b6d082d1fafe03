package com.wine.resolution.merge;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.UnresolvedWineRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of enriching an unresolved record.
 *
 * @param record       the enriched record, or the input unchanged
 * @param matched      the catalog record the values came from, null when nothing matched
 * @param filledFields names of the fields that were filled, in merge order
 */
public record EnrichmentResult(UnresolvedWineRecord record, CanonicalWineRecord matched, List<String> filledFields) {

    public EnrichmentResult {
        Objects.requireNonNull(record, "record is required");
        filledFields = filledFields != null ? List.copyOf(filledFields) : List.of();
    }

    public static EnrichmentResult unchanged(UnresolvedWineRecord record) {
        return new EnrichmentResult(record, null, List.of());
    }

    public Optional<CanonicalWineRecord> getMatched() {
        return Optional.ofNullable(matched);
    }

    /**
     * True if at least one field was filled from the catalog.
     */
    public boolean isEnriched() {
        return !filledFields.isEmpty();
    }
}
