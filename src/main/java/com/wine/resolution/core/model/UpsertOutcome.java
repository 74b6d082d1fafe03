package com.wine.resolution.core.model;

import java.util.Objects;

/**
 * Result of upserting one normalized row into the catalog.
 *
 * @param inserted true if a new canonical record was created
 * @param updated  true if an existing canonical record was overwritten
 * @param record   the stored record after the write
 */
public record UpsertOutcome(boolean inserted, boolean updated, CanonicalWineRecord record) {

    public UpsertOutcome {
        Objects.requireNonNull(record, "record is required");
        if (inserted == updated) {
            throw new IllegalArgumentException("Exactly one of inserted/updated must be set");
        }
    }

    public static UpsertOutcome inserted(CanonicalWineRecord record) {
        return new UpsertOutcome(true, false, record);
    }

    public static UpsertOutcome updated(CanonicalWineRecord record) {
        return new UpsertOutcome(false, true, record);
    }

    public RowOutcome toRowOutcome() {
        return inserted ? RowOutcome.INSERTED : RowOutcome.UPDATED;
    }
}
