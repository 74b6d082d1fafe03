package com.wine.resolution.cache;

import com.wine.resolution.api.ResolutionResult;

import java.util.Optional;

/**
 * Cache that never holds anything. Default when caching is not configured.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionResult> get(ResolutionKey key) {
        return Optional.empty();
    }

    @Override
    public long generation() {
        return 0;
    }

    @Override
    public void put(ResolutionKey key, ResolutionResult result, long generation) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
