package com.wine.resolution.cache;

import com.wine.resolution.api.ResolutionResult;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCacheTest {

    private static final ResolutionKey MARGAUX = ResolutionKey.of(
            UnresolvedWineRecord.builder("Margaux").producer("Château Margaux").vintage(2015).build());

    private ResolutionResult createTestResult(String id) {
        return ResolutionResult.codeMatch(CanonicalWineRecord.builder().id(id).name("Château Margaux").build());
    }

    @Nested
    @DisplayName("ResolutionKey")
    class KeyTests {

        @Test
        @DisplayName("Casing and surrounding whitespace map to the same key")
        void testFolding() {
            ResolutionKey noisy = ResolutionKey.of(
                    UnresolvedWineRecord.builder("  MARGAUX ").producer("château margaux").vintage(2015).build());
            assertEquals(MARGAUX, noisy);
        }

        @Test
        @DisplayName("Vintage and identity codes are part of the key")
        void testDiscriminatingFields() {
            assertNotEquals(MARGAUX, ResolutionKey.of(
                    UnresolvedWineRecord.builder("Margaux").producer("Château Margaux").vintage(2016).build()));
            assertNotEquals(MARGAUX, ResolutionKey.of(UnresolvedWineRecord.builder("Margaux")
                    .producer("Château Margaux").vintage(2015).suggestedLwin("1023456").build()));
        }
    }

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            cache.put(MARGAUX, createTestResult("id1"));
            assertTrue(cache.get(MARGAUX).isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpResolutionCache().getStats();
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0, stats.size());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve results")
        void testPutAndGet() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());

            cache.put(MARGAUX, createTestResult("id1"));
            Optional<ResolutionResult> cached = cache.get(MARGAUX);

            assertTrue(cached.isPresent());
            assertEquals("id1", cached.get().match().getId());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(MARGAUX, createTestResult("id1"));

            cache.get(MARGAUX);
            cache.get(MARGAUX);
            cache.get(ResolutionKey.of(UnresolvedWineRecord.builder("Opus One").build()));

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Results computed before an invalidation are dropped")
        void testStaleGenerationDropped() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            long resolvedAt = cache.generation();

            cache.onCatalogChanged(0, 1);
            cache.put(MARGAUX, createTestResult("id1"), resolvedAt);

            assertTrue(cache.get(MARGAUX).isEmpty());
            assertEquals(resolvedAt + 1, cache.generation());

            cache.put(MARGAUX, createTestResult("id2"), cache.generation());
            assertEquals("id2", cache.get(MARGAUX).orElseThrow().match().getId());
        }

        @Test
        @DisplayName("A catalog change clears every entry")
        void testCatalogChangeInvalidates() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.put(MARGAUX, createTestResult("id1"));

            cache.onCatalogChanged(1, 0);

            assertTrue(cache.get(MARGAUX).isEmpty());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should reject non-positive sizes and TTLs")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        @DisplayName("Disabled config is flagged")
        void testDisabled() {
            assertFalse(CacheConfig.disabled().enabled());
            assertTrue(CacheConfig.defaults().enabled());
        }
    }
}
