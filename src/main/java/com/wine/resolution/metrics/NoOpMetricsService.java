package com.wine.resolution.metrics;

import com.wine.resolution.core.model.ResolutionOutcome;
import com.wine.resolution.core.model.RowOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(ResolutionOutcome outcome, Duration duration) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordMatchScore(int score) {
    }

    @Override
    public void incrementCatalogRow(RowOutcome outcome) {
    }

    @Override
    public void recordImportDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
