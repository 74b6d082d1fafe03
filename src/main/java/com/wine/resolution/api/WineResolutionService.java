package com.wine.resolution.api;

import com.wine.resolution.cache.NoOpResolutionCache;
import com.wine.resolution.cache.ResolutionCache;
import com.wine.resolution.cache.ResolutionKey;
import com.wine.resolution.catalog.CatalogSearchService;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.MatchResult;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import com.wine.resolution.logging.LogContext;
import com.wine.resolution.matching.CandidateGenerator;
import com.wine.resolution.matching.WineMatchScorer;
import com.wine.resolution.merge.EnrichmentMerger;
import com.wine.resolution.merge.EnrichmentResult;
import com.wine.resolution.metrics.MetricsService;
import com.wine.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Query-path resolution of unresolved wine records against the catalog.
 *
 * <ol>
 *   <li>Identity codes carried by the input are looked up directly; a hit is returned unscored.</li>
 *   <li>Otherwise candidates are generated, scored and ranked by descending score. Equal scores
 *       keep the catalog's iteration order.</li>
 *   <li>The top candidate is accepted only if it reaches
 *       {@link MatchResult#ACCEPTANCE_THRESHOLD}.</li>
 * </ol>
 *
 * <p>Thread-safe. Store failures propagate to the caller.</p>
 */
public class WineResolutionService {
    private static final Logger log = LoggerFactory.getLogger(WineResolutionService.class);

    private final CandidateGenerator candidateGenerator;
    private final WineMatchScorer scorer;
    private final CatalogSearchService searchService;
    private final EnrichmentMerger merger;
    private final ResolutionCache cache;
    private final MetricsService metricsService;
    private final ResolutionOptions options;

    public WineResolutionService(CandidateGenerator candidateGenerator, WineMatchScorer scorer,
                                 CatalogSearchService searchService, EnrichmentMerger merger) {
        this(candidateGenerator, scorer, searchService, merger,
                new NoOpResolutionCache(), new NoOpMetricsService(), ResolutionOptions.defaults());
    }

    public WineResolutionService(CandidateGenerator candidateGenerator, WineMatchScorer scorer,
                                 CatalogSearchService searchService, EnrichmentMerger merger,
                                 ResolutionCache cache, MetricsService metricsService,
                                 ResolutionOptions options) {
        this.candidateGenerator = Objects.requireNonNull(candidateGenerator, "candidateGenerator is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.searchService = Objects.requireNonNull(searchService, "searchService is required");
        this.merger = Objects.requireNonNull(merger, "merger is required");
        this.cache = cache != null ? cache : new NoOpResolutionCache();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.options = options != null ? options : ResolutionOptions.defaults();
    }

    /**
     * Returns the accepted catalog record, or empty when there is no confident match.
     */
    public Optional<CanonicalWineRecord> resolve(UnresolvedWineRecord unresolved) {
        return resolveWithDetails(unresolved).getMatch();
    }

    public ResolutionResult resolveWithDetails(UnresolvedWineRecord unresolved) {
        Objects.requireNonNull(unresolved, "unresolved is required");
        ResolutionKey key = ResolutionKey.of(unresolved);

        Optional<ResolutionResult> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("resolve.cache.hit name='{}'", unresolved.getName());
            return cached.get().copy();
        }
        metricsService.recordCacheMiss();

        long generation = cache.generation();
        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forResolution(LogContext.generateCorrelationId(), unresolved.getName())) {
            ResolutionResult result = doResolve(unresolved);
            metricsService.recordResolution(result.outcome(), Duration.ofNanos(System.nanoTime() - startNanos));
            cache.put(key, result.copy(), generation);
            return result;
        }
    }

    /**
     * Resolves and fills the input's empty fields from the match. Without a match the input is
     * returned unchanged.
     */
    public EnrichmentResult resolveAndEnrich(UnresolvedWineRecord unresolved) {
        Optional<CanonicalWineRecord> match = resolve(unresolved);
        if (match.isEmpty()) {
            return EnrichmentResult.unchanged(unresolved);
        }
        return merger.enrichWithDetails(unresolved, match.get());
    }

    public Optional<CanonicalWineRecord> findByLwin(String code) {
        return searchService.findByLwin(code);
    }

    private ResolutionResult doResolve(UnresolvedWineRecord unresolved) {
        for (String code : identityCodes(unresolved)) {
            Optional<CanonicalWineRecord> direct = searchService.findByLwin(code);
            if (direct.isPresent()) {
                log.debug("resolve.matched outcome=CODE_MATCH code={} id={}", code, direct.get().getId());
                return ResolutionResult.codeMatch(direct.get());
            }
        }

        List<CanonicalWineRecord> candidates = candidateGenerator.generate(unresolved, options.getCandidateLimit());
        metricsService.recordCandidateCount(candidates.size());

        List<MatchResult> ranked = rank(unresolved, candidates);
        ResolutionResult result = ResolutionResult.fromRanking(ranked, candidates.size());
        result.getBestCandidate().ifPresent(best -> metricsService.recordMatchScore(best.score()));

        if (result.isMatched()) {
            log.debug("resolve.matched outcome={} id={} best={}", result.outcome(), result.match().getId(), ranked.get(0));
        } else {
            log.debug("resolve.unmatched outcome={} candidates={} best={}",
                    result.outcome(), candidates.size(), result.getBestCandidate().orElse(null));
        }
        return result;
    }

    /**
     * Scores every candidate, drops those without a positive score and sorts the rest by
     * descending score. {@link List#sort} is stable, so ties stay in catalog order.
     */
    List<MatchResult> rank(UnresolvedWineRecord unresolved, List<CanonicalWineRecord> candidates) {
        List<MatchResult> ranked = new ArrayList<>(candidates.size());
        for (CanonicalWineRecord candidate : candidates) {
            MatchResult scored = scorer.score(unresolved, candidate);
            if (scored.score() > 0) {
                ranked.add(scored);
            }
        }
        ranked.sort(Comparator.comparingInt(MatchResult::score).reversed());
        return ranked;
    }

    /**
     * Codes worth a direct lookup, most trusted first: the extraction's suggestion, then the
     * codes carried by the record from most to least specific.
     */
    private static Set<String> identityCodes(UnresolvedWineRecord unresolved) {
        Set<String> codes = new LinkedHashSet<>();
        for (String code : new String[]{unresolved.getSuggestedLwin(), unresolved.getLwin18(),
                unresolved.getLwin11(), unresolved.getLwin7()}) {
            if (code != null && !code.isBlank()) {
                codes.add(code.trim());
            }
        }
        return codes;
    }
}
