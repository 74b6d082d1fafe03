package com.wine.resolution.metrics;

import com.wine.resolution.core.model.ResolutionOutcome;
import com.wine.resolution.core.model.RowOutcome;

import java.time.Duration;

/**
 * Interface for recording resolution and ingestion metrics.
 * The default {@link NoOpMetricsService} records nothing, so the library runs without
 * a metrics backend.
 */
public interface MetricsService {

    void recordResolution(ResolutionOutcome outcome, Duration duration);

    void recordCandidateCount(int count);

    void recordMatchScore(int score);

    void incrementCatalogRow(RowOutcome outcome);

    void recordImportDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
