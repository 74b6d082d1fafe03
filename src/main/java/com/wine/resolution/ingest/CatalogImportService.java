package com.wine.resolution.ingest;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.RowOutcome;
import com.wine.resolution.core.model.UpsertOutcome;
import com.wine.resolution.logging.LogContext;
import com.wine.resolution.metrics.MetricsService;
import com.wine.resolution.metrics.NoOpMetricsService;
import com.wine.resolution.rules.CatalogColumn;
import com.wine.resolution.rules.CatalogRowMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ingests reference-dataset rows into the catalog.
 *
 * <p>Rows are processed one at a time in fixed-size batches: each upsert must see the
 * writes of the rows before it, otherwise repeated identity codes in one file would create
 * duplicate canonical records. A lock keeps two imports from interleaving.</p>
 */
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final IdentityResolver identityResolver;
    private final CatalogRowMapper rowMapper;
    private final ImportOptions options;
    private final MetricsService metricsService;
    private final List<CatalogChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock importLock = new ReentrantLock();

    public CatalogImportService(IdentityResolver identityResolver, CatalogRowMapper rowMapper) {
        this(identityResolver, rowMapper, ImportOptions.defaults(), new NoOpMetricsService());
    }

    public CatalogImportService(IdentityResolver identityResolver, CatalogRowMapper rowMapper,
                                ImportOptions options, MetricsService metricsService) {
        this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver is required");
        this.rowMapper = Objects.requireNonNull(rowMapper, "rowMapper is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public void addListener(CatalogChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public ImportResult importRows(List<Map<String, String>> rows) {
        return importRows(rows, "rows", ProgressCallback.NOOP);
    }

    /**
     * Imports the given rows.
     *
     * @param rows     rows keyed by source column name
     * @param format   label of the source format, for logging
     * @param callback progress callback, called after every batch
     * @return the counters of the import; row failures are listed, never thrown
     */
    public ImportResult importRows(List<Map<String, String>> rows, String format, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long startNanos = System.nanoTime();

        importLock.lock();
        try (LogContext ignored = LogContext.forImport(LogContext.generateCorrelationId(), format)) {
            log.info("import.started rows={} batchSize={} source={}",
                    rows.size(), options.getBatchSize(), options.getDataSource().label());

            Counters counters = new Counters();
            int batchSize = options.getBatchSize();
            int batchNumber = 0;
            for (int from = 0; from < rows.size(); from += batchSize) {
                int to = Math.min(from + batchSize, rows.size());
                batchNumber++;
                long insertedBefore = counters.inserted;
                long updatedBefore = counters.updated;

                for (int i = from; i < to; i++) {
                    importRow(rows.get(i), i + 1, counters);
                }

                notifyListeners(counters.inserted - insertedBefore, counters.updated - updatedBefore);
                cb.onBatchCompleted(batchNumber, to, rows.size());
                log.debug("import.batch.completed batch={} processed={} total={}", batchNumber, to, rows.size());
            }

            ImportResult result = counters.toResult();
            metricsService.recordImportDuration(Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("import.completed result={}", result);
            return result;
        } finally {
            importLock.unlock();
        }
    }

    private void importRow(Map<String, String> row, long rowNumber, Counters counters) {
        counters.total++;
        try {
            Optional<CanonicalWineRecord> mapped = rowMapper.map(row, options.getDataSource());
            if (mapped.isEmpty()) {
                counters.skipped++;
                metricsService.incrementCatalogRow(RowOutcome.SKIPPED);
                log.debug("import.row.skipped row={} reason=no name or lwin", rowNumber);
                return;
            }
            UpsertOutcome outcome = identityResolver.upsert(mapped.get());
            if (outcome.inserted()) {
                counters.inserted++;
            } else {
                counters.updated++;
            }
            metricsService.incrementCatalogRow(outcome.toRowOutcome());
        } catch (RuntimeException e) {
            String name = CatalogColumn.NAME.read(row);
            String lwin = CatalogColumn.LWIN.read(row);
            counters.errors.add(new ImportResult.ImportError(rowNumber, name, lwin, e.getMessage()));
            metricsService.incrementCatalogRow(RowOutcome.FAILED);
            log.warn("import.row.error row={} name='{}' lwin={} error={}", rowNumber, name, lwin, e.getMessage());
        }
    }

    private void notifyListeners(long inserted, long updated) {
        if (inserted == 0 && updated == 0) {
            return;
        }
        for (CatalogChangeListener listener : listeners) {
            try {
                listener.onCatalogChanged(inserted, updated);
            } catch (RuntimeException e) {
                log.warn("import.listener.error listener={} error={}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private static final class Counters {
        long total;
        long inserted;
        long updated;
        long skipped;
        final List<ImportResult.ImportError> errors = new ArrayList<>();

        ImportResult toResult() {
            return new ImportResult(total, inserted, updated, skipped, errors);
        }
    }
}
