package com.wine.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wine.resolution.api.ResolutionResult;
import com.wine.resolution.ingest.CatalogChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed resolution cache. Registered as a {@link CatalogChangeListener},
 * it drops every entry when an import writes to the catalog: a new or updated record
 * can change any earlier resolution, including former no-matches.
 *
 * <p>Each invalidation starts a new generation. A result computed against an older generation
 * is never kept, even when its {@code put} races with the invalidation.</p>
 */
public class CaffeineResolutionCache implements ResolutionCache, CatalogChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<ResolutionKey, ResolutionResult> cache;
    private final AtomicLong generation = new AtomicLong();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ResolutionResult> get(ResolutionKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public void put(ResolutionKey key, ResolutionResult result, long resolvedAt) {
        if (generation.get() != resolvedAt) {
            log.debug("cache.put.skipped key={} reason=catalog changed during resolution", key);
            return;
        }
        cache.put(key, result);
        // an invalidation may have landed between the check and the put
        if (generation.get() != resolvedAt) {
            cache.invalidate(key);
        }
    }

    @Override
    public void invalidateAll() {
        generation.incrementAndGet();
        cache.invalidateAll();
        log.debug("Invalidated all resolution cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onCatalogChanged(long inserted, long updated) {
        invalidateAll();
        log.debug("Resolution cache cleared after catalog change: inserted={}, updated={}", inserted, updated);
    }
}
