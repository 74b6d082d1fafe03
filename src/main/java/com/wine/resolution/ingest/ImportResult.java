package com.wine.resolution.ingest;

import java.util.List;

/**
 * Counters of a catalog import.
 *
 * @param totalRecords number of rows read from the source
 * @param inserted     rows that created a new canonical record
 * @param updated      rows that overwrote an existing canonical record
 * @param skipped      rows with neither a name nor an identity code
 * @param errors       rows that failed to normalize or to be written
 */
public record ImportResult(
        long totalRecords,
        long inserted,
        long updated,
        long skipped,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ImportResult empty() {
        return new ImportResult(0, 0, 0, 0, List.of());
    }

    public long successCount() {
        return inserted + updated;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be imported.
     *
     * @param rowNumber 1-based position of the row in the source, header excluded
     * @param inputName the row's name value, if any
     * @param lwin      the row's identity code value, if any
     * @param message   the failure message
     */
    public record ImportError(long rowNumber, String inputName, String lwin, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", inserted=" + inserted +
                ", updated=" + updated +
                ", skipped=" + skipped +
                ", errors=" + errors.size() + '}';
    }
}
