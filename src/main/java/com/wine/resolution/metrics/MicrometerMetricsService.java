package com.wine.resolution.metrics;

import com.wine.resolution.core.model.ResolutionOutcome;
import com.wine.resolution.core.model.RowOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code wine.resolution.duration}: Timer (tag: outcome)</li>
 *   <li>{@code wine.candidates.count}: DistributionSummary</li>
 *   <li>{@code wine.match.score}: DistributionSummary of the best candidate score</li>
 *   <li>{@code wine.catalog.rows}: Counter (tag: outcome)</li>
 *   <li>{@code wine.import.duration}: Timer</li>
 *   <li>{@code wine.cache.hit}, {@code wine.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<ResolutionOutcome, Timer> resolutionTimers = new EnumMap<>(ResolutionOutcome.class);
    private final Map<RowOutcome, Counter> rowCounters = new EnumMap<>(RowOutcome.class);
    private final DistributionSummary candidateCountSummary;
    private final DistributionSummary matchScoreSummary;
    private final Timer importTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (ResolutionOutcome outcome : ResolutionOutcome.values()) {
            resolutionTimers.put(outcome, Timer.builder("wine.resolution.duration")
                    .description("Duration of wine resolution calls")
                    .tag("outcome", outcome.name())
                    .register(registry));
        }
        for (RowOutcome outcome : RowOutcome.values()) {
            rowCounters.put(outcome, Counter.builder("wine.catalog.rows")
                    .description("Catalog rows processed during ingestion")
                    .tag("outcome", outcome.name())
                    .register(registry));
        }
        this.candidateCountSummary = DistributionSummary.builder("wine.candidates.count")
                .description("Number of catalog candidates retrieved per resolution")
                .register(registry);
        this.matchScoreSummary = DistributionSummary.builder("wine.match.score")
                .description("Score of the best candidate per resolution")
                .register(registry);
        this.importTimer = Timer.builder("wine.import.duration")
                .description("Duration of catalog imports")
                .register(registry);
        this.cacheHitCounter = Counter.builder("wine.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("wine.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordResolution(ResolutionOutcome outcome, Duration duration) {
        resolutionTimers.get(outcome).record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateCountSummary.record(count);
    }

    @Override
    public void recordMatchScore(int score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void incrementCatalogRow(RowOutcome outcome) {
        rowCounters.get(outcome).increment();
    }

    @Override
    public void recordImportDuration(Duration duration) {
        importTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
