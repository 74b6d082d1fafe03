package com.wine.resolution.api;

import com.wine.resolution.cache.CacheConfig;
import com.wine.resolution.catalog.CatalogSearchQuery;
import com.wine.resolution.catalog.InMemoryCatalogStore;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.ResolutionOutcome;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import com.wine.resolution.core.model.WineCategory;
import com.wine.resolution.ingest.ImportResult;
import com.wine.resolution.ingest.ProgressCallback;
import com.wine.resolution.merge.EnrichmentResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WineResolver Tests")
class WineResolverTest {

    private static final String CATALOG_CSV = """
            LWIN,WINE,PRODUCER_NAME,COUNTRY,REGION,COLOUR
            1023456,Château Margaux,Château Margaux,France,Bordeaux,Red
            1012345,Grande Cuvée,Krug,France,Champagne,White
            1098765,Tignanello,Antinori,Italy,Tuscany,Red
            """;

    private InMemoryCatalogStore store;
    private WineResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        resolver = WineResolver.builder()
                .catalogStore(store)
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @Test
    @DisplayName("Imported catalog resolves and enriches an extracted label")
    void importResolveEnrich() {
        ImportResult imported = resolver.importCsv(new StringReader(CATALOG_CSV), ProgressCallback.NOOP);
        assertEquals(3, imported.inserted());
        assertFalse(imported.hasErrors());

        UnresolvedWineRecord extracted = resolver.parseExtraction("""
                {"name": "Margaux", "producer": "Château Margaux", "region": "Bordeaux",
                 "country": "France", "vintage": "2015"}
                """);

        ResolutionResult result = resolver.resolveWithDetails(extracted);
        assertEquals(ResolutionOutcome.SCORED_MATCH, result.outcome());
        assertEquals(70, result.getBestCandidate().orElseThrow().score());

        EnrichmentResult enriched = resolver.resolveAndEnrich(extracted);
        assertEquals("1023456", enriched.record().getLwin7());
        assertEquals(Integer.valueOf(2015), enriched.record().getVintage());
    }

    @Test
    @DisplayName("Re-importing the same file updates instead of duplicating")
    void reimportIsIdempotent() {
        resolver.importCsv(new StringReader(CATALOG_CSV), ProgressCallback.NOOP);
        ImportResult second = resolver.importCsv(new StringReader(CATALOG_CSV), ProgressCallback.NOOP);

        assertEquals(0, second.inserted());
        assertEquals(3, second.updated());
        assertEquals(3, store.size());
        assertEquals(3, resolver.statistics().totalRecords());
    }

    @Test
    @DisplayName("An import invalidates cached resolutions")
    void importInvalidatesCache() {
        resolver.importCsv(new StringReader(CATALOG_CSV), ProgressCallback.NOOP);
        UnresolvedWineRecord opus = UnresolvedWineRecord.builder("Opus One").producer("Opus One Winery").build();

        assertTrue(resolver.resolve(opus).isEmpty());
        assertTrue(resolver.resolve(opus).isEmpty());
        assertEquals(1, resolver.getCacheStats().hitCount());

        resolver.importCsv(new StringReader("""
                LWIN,WINE,PRODUCER_NAME,COUNTRY
                1111111,Opus One,Opus One Winery,USA
                """), ProgressCallback.NOOP);

        assertEquals("1111111", resolver.resolve(opus).orElseThrow().getLwin7());
    }

    @Test
    @DisplayName("JSON catalog import and browsing")
    void jsonImportAndSearch() {
        ImportResult imported = resolver.importJson(new StringReader("""
                [{"LWIN": "1098765", "WINE": "Tignanello", "PRODUCER_NAME": "Antinori", "COUNTRY": "Italy", "COLOUR": "Red"},
                 {"LWIN": "1012345", "WINE": "Grande Cuvée", "PRODUCER_NAME": "Krug", "COUNTRY": "France", "COLOUR": "White"}]
                """), ProgressCallback.NOOP);

        assertEquals(2, imported.inserted());
        List<CanonicalWineRecord> italian = resolver.search(CatalogSearchQuery.builder().country("Italy").build());
        assertEquals(1, italian.size());
        assertEquals(WineCategory.RED, italian.get(0).getCategory());
        assertEquals("Grande Cuvée", resolver.findByLwin("1012345").orElseThrow().getName());
    }

    @Test
    @DisplayName("Async resolution shares the same pipeline")
    void asyncResolution() throws Exception {
        resolver.importCsv(new StringReader(CATALOG_CSV), ProgressCallback.NOOP);

        ResolutionResult result = resolver.async()
                .resolveAsync(UnresolvedWineRecord.builder("Tignanello").producer("Antinori").build())
                .get();

        assertEquals("1098765", result.match().getLwin7());
        assertSame(resolver.async(), resolver.async());
    }

    @Test
    @DisplayName("A catalog store is required")
    void storeRequired() {
        assertThrows(IllegalStateException.class, () -> WineResolver.builder().build());
    }
}
