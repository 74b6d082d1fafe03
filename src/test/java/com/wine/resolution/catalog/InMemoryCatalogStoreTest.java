package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCatalogStore Tests")
class InMemoryCatalogStoreTest {

    private InMemoryCatalogStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
    }

    private static CanonicalWineRecord wine(String name, String lwin7) {
        return CanonicalWineRecord.builder().name(name).lwin7(lwin7).build();
    }

    @Test
    @DisplayName("Inserted records can be found by filter")
    void insertAndFind() {
        store.insert(wine("Chateau Margaux", "1023456"));

        CanonicalWineRecord found = store.findOne(CatalogFilter.eq(CatalogField.LWIN7, "1023456")).orElseThrow();
        assertEquals("Chateau Margaux", found.getName());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Stored state cannot be mutated through returned records")
    void recordsAreCopied() {
        CanonicalWineRecord inserted = store.insert(wine("Chateau Margaux", "1023456"));
        inserted.setName("Mutated");

        CanonicalWineRecord found = store.findOne(CatalogFilter.eq(CatalogField.LWIN7, "1023456")).orElseThrow();
        found.setProducer("Mutated");

        CanonicalWineRecord again = store.findOne(CatalogFilter.eq(CatalogField.LWIN7, "1023456")).orElseThrow();
        assertEquals("Chateau Margaux", again.getName());
        assertNull(again.getProducer());
    }

    @Test
    @DisplayName("Update replaces the stored record")
    void update() {
        CanonicalWineRecord inserted = store.insert(wine("Chateau Margaux", "1023456"));
        inserted.setRegion("Bordeaux");
        store.update(inserted);

        assertEquals("Bordeaux", store.findOne(CatalogFilter.eq(CatalogField.LWIN7, "1023456")).orElseThrow().getRegion());
    }

    @Test
    @DisplayName("Duplicate ids and unknown updates fail")
    void storeErrors() {
        CanonicalWineRecord record = store.insert(wine("Chateau Margaux", "1023456"));

        assertThrows(CatalogStoreException.class, () -> store.insert(record));
        assertThrows(CatalogStoreException.class, () -> store.update(wine("Other", null)));
    }

    @Test
    @DisplayName("findMany honours the limit and insertion order")
    void findManyLimit() {
        for (int i = 0; i < 5; i++) {
            store.insert(wine("Wine " + i, null));
        }

        List<CanonicalWineRecord> found = store.findMany(CatalogFilter.containsIgnoreCase(CatalogField.NAME, "wine"), 3);

        assertEquals(List.of("Wine 0", "Wine 1", "Wine 2"), found.stream().map(CanonicalWineRecord::getName).toList());
        assertThrows(IllegalArgumentException.class, () -> store.findMany(CatalogFilter.canonical(), 0));
    }

    @Nested
    @DisplayName("CatalogFilter")
    class Filters {

        private final CanonicalWineRecord catalogWine = CanonicalWineRecord.builder()
                .name("Chateau Margaux").country("France").producer("Chateau Margaux").build();

        @Test
        @DisplayName("Substring match ignores case")
        void containsIgnoreCase() {
            assertTrue(CatalogFilter.containsIgnoreCase(CatalogField.NAME, "MARGAUX").test(catalogWine));
            assertFalse(CatalogFilter.containsIgnoreCase(CatalogField.REGION, "bordeaux").test(catalogWine));
            assertThrows(IllegalArgumentException.class, () -> CatalogFilter.containsIgnoreCase(CatalogField.NAME, ""));
        }

        @Test
        @DisplayName("Catalog scope excludes owned copies and other sources")
        void catalogScope() {
            CanonicalWineRecord owned = CanonicalWineRecord.builder(catalogWine).owner("user-1").build();
            CanonicalWineRecord manual = CanonicalWineRecord.builder(catalogWine).dataSource(DataSource.MANUAL).build();

            assertTrue(CatalogFilter.catalogSourced().test(catalogWine));
            assertFalse(CatalogFilter.catalogSourced().test(owned));
            assertFalse(CatalogFilter.catalogSourced().test(manual));
            assertTrue(CatalogFilter.canonical().test(manual));
        }

        @Test
        @DisplayName("AND and OR compose")
        void composition() {
            CatalogFilter filter = CatalogFilter.and(
                    CatalogFilter.or(List.of(
                            CatalogFilter.containsIgnoreCase(CatalogField.NAME, "latour"),
                            CatalogFilter.containsIgnoreCase(CatalogField.PRODUCER, "margaux"))),
                    CatalogFilter.eq(CatalogField.COUNTRY, "France"));

            assertTrue(filter.test(catalogWine));
            assertEquals("((name ~* 'latour' OR producer ~* 'margaux') AND country = 'France')", filter.toString());
            assertThrows(IllegalArgumentException.class, () -> CatalogFilter.or(List.of()));
        }
    }
}
