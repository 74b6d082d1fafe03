package com.wine.resolution.cache;

import com.wine.resolution.api.ResolutionResult;

import java.util.Optional;

/**
 * Cache of resolution results, including no-match results.
 * Entries go stale when the catalog changes, so implementations backed by real storage
 * should also listen for catalog writes.
 */
public interface ResolutionCache {

    Optional<ResolutionResult> get(ResolutionKey key);

    /**
     * Catalog generation as seen by this cache. Read it before resolving and hand it back to
     * {@link #put(ResolutionKey, ResolutionResult, long)}.
     */
    long generation();

    /**
     * Stores a result computed while the catalog was at {@code generation}. Results computed
     * before the latest invalidation are dropped.
     */
    void put(ResolutionKey key, ResolutionResult result, long generation);

    default void put(ResolutionKey key, ResolutionResult result) {
        put(key, result, generation());
    }

    /**
     * Drops every entry and starts a new generation.
     */
    void invalidateAll();

    CacheStats getStats();
}
