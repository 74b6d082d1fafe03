package com.wine.resolution.rules;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.DataSource;
import com.wine.resolution.core.model.WineCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogRowMapper Tests")
class CatalogRowMapperTest {

    private final CatalogRowMapper mapper = new CatalogRowMapper();

    @Test
    @DisplayName("Maps a full LWIN dataset row")
    void mapsFullRow() {
        Map<String, String> row = new HashMap<>();
        row.put("LWIN", "1023456");
        row.put("WINE", "Chateau Margaux");
        row.put("PRODUCER_NAME", "Chateau Margaux");
        row.put("PRODUCER_TITLE", "Chateau");
        row.put("COUNTRY", "France");
        row.put("REGION", "Bordeaux");
        row.put("SUB_REGION", "Medoc");
        row.put("COLOUR", "Red");
        row.put("DESIGNATION", "Margaux");
        row.put("CLASSIFICATION", "Premier Grand Cru Classe");
        row.put("STATUS", "Live");
        row.put("DATE_ADDED", "2016-02-11 00:00:00");
        row.put("DATE_UPDATED", "2019-03-14");

        CanonicalWineRecord record = mapper.map(row, DataSource.CATALOG_IMPORT).orElseThrow();

        assertEquals("1023456", record.getLwin7());
        assertNull(record.getLwin11());
        assertEquals("Chateau Margaux", record.getName());
        assertEquals("Chateau", record.getProducerTitle());
        assertEquals("Medoc", record.getSubRegion());
        assertEquals(WineCategory.RED, record.getCategory());
        assertFalse(record.isCategoryInferred());
        assertEquals("Margaux", record.getDesignation());
        assertEquals("Live", record.getLwinStatus());
        assertEquals(LocalDateTime.of(2016, 2, 11, 0, 0), record.getLwinDateAdded());
        assertEquals(LocalDateTime.of(2019, 3, 14, 0, 0), record.getLwinDateUpdated());
        assertEquals(DataSource.CATALOG_IMPORT, record.getDataSource());
    }

    @Test
    @DisplayName("lwin11 is derived from lwin7 and vintage")
    void derivesLwin11FromVintage() {
        CanonicalWineRecord record = mapper.map(
                Map.of("lwin", "1023456", "name", "Margaux", "vintage", "2015"), DataSource.CATALOG_IMPORT).orElseThrow();

        assertEquals("1023456", record.getLwin7());
        assertEquals("10234562015", record.getLwin11());
        assertEquals(2015, record.getVintage());
    }

    @Test
    @DisplayName("Long base codes yield every variant from their prefix")
    void derivesFromLongBase() {
        CanonicalWineRecord record = mapper.map(
                Map.of("LWIN", "102345620150600750", "WINE", "Margaux"), DataSource.CATALOG_IMPORT).orElseThrow();

        assertEquals("1023456", record.getLwin7());
        assertEquals("10234562015", record.getLwin11());
        assertEquals("102345620150600750", record.getLwin18());
    }

    @Test
    @DisplayName("Rows with neither name nor code are rejected")
    void rejectsEmptyIdentity() {
        Optional<CanonicalWineRecord> mapped = mapper.map(
                Map.of("PRODUCER_NAME", "Somebody", "COUNTRY", "France"), DataSource.CATALOG_IMPORT);
        assertTrue(mapped.isEmpty());
    }

    @Test
    @DisplayName("Synthetic name joins producer and vintage")
    void syntheticName() {
        CanonicalWineRecord record = mapper.map(
                Map.of("LWIN", "1023456", "PRODUCER_NAME", "Krug", "vintage", "2008"), DataSource.CATALOG_IMPORT)
                .orElseThrow();

        assertEquals("Krug 2008", record.getName());
        assertEquals("Wine 1023456", CatalogRowMapper.syntheticName(null, null, "1023456"));
        assertEquals("Krug", CatalogRowMapper.syntheticName("Krug", null, "1023456"));
    }

    @Test
    @DisplayName("Unknown colour falls back to red and is flagged")
    void unknownCategoryFlagged() {
        CanonicalWineRecord record = mapper.map(Map.of("WINE", "Mystery", "COLOUR", "Orange"), DataSource.MANUAL)
                .orElseThrow();

        assertEquals(WineCategory.RED, record.getCategory());
        assertTrue(record.isCategoryInferred());
        assertEquals(DataSource.MANUAL, record.getDataSource());
    }

    @Test
    @DisplayName("Malformed derived codes raise")
    void malformedCode() {
        assertThrows(IllegalArgumentException.class,
                () -> mapper.map(Map.of("LWIN", "10X3456", "WINE", "Margaux"), DataSource.CATALOG_IMPORT));
    }

    @Test
    @DisplayName("Unparseable dates are dropped")
    void unparseableDate() {
        assertNull(CatalogRowMapper.parseDate("14/03/2019"));
        assertNull(CatalogRowMapper.parseDate(null));
        assertEquals(LocalDateTime.of(2019, 3, 14, 10, 22), CatalogRowMapper.parseDate("2019-03-14T10:22:00"));
    }
}
