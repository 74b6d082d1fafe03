package com.wine.resolution.cache;

/**
 * Configuration for the resolution cache.
 *
 * @param maxSize    maximum number of cached resolutions
 * @param ttlSeconds time-to-live of each entry
 * @param enabled    whether a cache is built at all
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 entries for ten minutes. Catalog writes clear the cache regardless of age.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
