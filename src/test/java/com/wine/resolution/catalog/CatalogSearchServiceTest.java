package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.WineCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogSearchService Tests")
class CatalogSearchServiceTest {

    private InMemoryCatalogStore store;
    private CatalogSearchService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        service = new CatalogSearchService(store);

        store.insert(CanonicalWineRecord.builder().name("Chateau Margaux").producer("Chateau Margaux")
                .lwin7("1023456").lwin11("10234562015").vintage(2015)
                .country("France").region("Bordeaux").category(WineCategory.RED).build());
        store.insert(CanonicalWineRecord.builder().name("Grande Cuvee").producer("Krug")
                .lwin7("1012345").country("France").region("Champagne").category(WineCategory.SPARKLING).build());
        store.insert(CanonicalWineRecord.builder().name("Opus One").producer("Opus One Winery")
                .lwin7("1099999").country("USA").region("Napa Valley").category(WineCategory.RED).build());
        store.insert(CanonicalWineRecord.builder().name("Private Margaux").owner("user-1")
                .lwin7("1555555").country("France").build());
    }

    @Nested
    @DisplayName("findByLwin")
    class FindByLwin {

        @Test
        @DisplayName("Code length picks the field")
        void byLength() {
            assertEquals("Chateau Margaux", service.findByLwin("1023456").orElseThrow().getName());
            assertEquals("Chateau Margaux", service.findByLwin("10234562015").orElseThrow().getName());
        }

        @Test
        @DisplayName("Unsupported lengths and owned records find nothing")
        void noMatch() {
            assertTrue(service.findByLwin("12345").isEmpty());
            assertTrue(service.findByLwin(null).isEmpty());
            assertTrue(service.findByLwin("1555555").isEmpty());
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("Text matches name or producer")
        void text() {
            List<CanonicalWineRecord> found = service.search(CatalogSearchQuery.builder().text("krug").build());
            assertEquals(List.of("Grande Cuvee"), found.stream().map(CanonicalWineRecord::getName).toList());
        }

        @Test
        @DisplayName("Owned records are never returned")
        void ownedExcluded() {
            List<CanonicalWineRecord> found = service.search(CatalogSearchQuery.builder().text("margaux").build());
            assertEquals(List.of("Chateau Margaux"), found.stream().map(CanonicalWineRecord::getName).toList());
        }

        @Test
        @DisplayName("Exact filters narrow the result")
        void exactFilters() {
            assertEquals(2, service.search(CatalogSearchQuery.builder().country("France").build()).size());
            assertEquals(1, service.search(CatalogSearchQuery.builder()
                    .country("France").category(WineCategory.SPARKLING).build()).size());
            assertEquals(1, service.search(CatalogSearchQuery.builder().vintage(2015).build()).size());
            assertTrue(service.search(CatalogSearchQuery.builder().region("bordeaux").build()).isEmpty());
        }

        @Test
        @DisplayName("Skip and limit page through results")
        void paging() {
            List<CanonicalWineRecord> second = service.search(CatalogSearchQuery.builder().skip(1).limit(1).build());
            assertEquals(List.of("Grande Cuvee"), second.stream().map(CanonicalWineRecord::getName).toList());
            assertTrue(service.search(CatalogSearchQuery.builder().skip(10).build()).isEmpty());
        }

        @Test
        @DisplayName("Limit is bounded")
        void limitBounds() {
            assertEquals(50, CatalogSearchQuery.builder().build().getLimit());
            assertThrows(IllegalArgumentException.class, () -> CatalogSearchQuery.builder().limit(101));
            assertThrows(IllegalArgumentException.class, () -> CatalogSearchQuery.builder().skip(-1));
        }
    }

    @Test
    @DisplayName("Statistics count catalog records by category and country")
    void statistics() {
        CatalogStatistics stats = service.statistics();

        assertEquals(3, stats.totalRecords());
        assertEquals(2L, stats.byCategory().get(WineCategory.RED));
        assertEquals(1L, stats.byCategory().get(WineCategory.SPARKLING));
        assertEquals(List.of(Map.entry("France", 2L), Map.entry("USA", 1L)),
                List.copyOf(stats.topCountries().entrySet()));
    }
}
