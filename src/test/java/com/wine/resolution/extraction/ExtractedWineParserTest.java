package com.wine.resolution.extraction;

import com.wine.resolution.core.model.DataSource;
import com.wine.resolution.core.model.GrapeVariety;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import com.wine.resolution.core.model.WineCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtractedWineParser Tests")
class ExtractedWineParserTest {

    private final ExtractedWineParser parser = new ExtractedWineParser();

    @Test
    @DisplayName("Should read a full extraction")
    void parsesFullExtraction() {
        UnresolvedWineRecord record = parser.parse("""
                {
                  "name": "Château Margaux",
                  "producer": "Château Margaux",
                  "vintage": 2015,
                  "country": "France",
                  "region": "Bordeaux",
                  "appellation": "Margaux",
                  "classification": "Premier Grand Cru Classé",
                  "wine_type": "Red wine",
                  "alcohol_content": "13.5%",
                  "grape_varieties": [{"name": "Cabernet Sauvignon", "percentage": 87}, "Merlot"],
                  "suggested_lwin7": "1023456",
                  "confidence_score": 0.92
                }
                """);

        assertEquals("Château Margaux", record.getName());
        assertEquals(Integer.valueOf(2015), record.getVintage());
        assertEquals("Margaux", record.getAppellation());
        assertEquals(WineCategory.RED, record.getCategory());
        assertEquals(13.5, record.getAlcoholContent());
        assertEquals(List.of(new GrapeVariety("Cabernet Sauvignon", 87.0), GrapeVariety.of("Merlot")),
                record.getGrapeVarieties());
        assertEquals("1023456", record.getSuggestedLwin());
        assertEquals(0.92, record.getConfidenceScore());
        assertEquals(DataSource.AI_EXTRACTED, record.getDataSource());
    }

    @Test
    @DisplayName("Should ignore a markdown code fence")
    void stripsCodeFence() {
        UnresolvedWineRecord record = parser.parse("""
                ```json
                {"name": "Tignanello", "vintage": "2019"}
                ```
                """);

        assertEquals("Tignanello", record.getName());
        assertEquals(Integer.valueOf(2019), record.getVintage());
    }

    @Test
    @DisplayName("Malformed loose values are dropped, not errors")
    void dropsMalformedValues() {
        UnresolvedWineRecord record = parser.parse("""
                {"name": "Opus One", "vintage": "NV", "alcohol_content": "strong",
                 "wine_type": "orange", "grape_varieties": "Cabernet Sauvignon, , Merlot"}
                """);

        assertNull(record.getVintage());
        assertNull(record.getAlcoholContent());
        assertNull(record.getCategory());
        assertEquals(List.of(GrapeVariety.of("Cabernet Sauvignon"), GrapeVariety.of("Merlot")),
                record.getGrapeVarieties());
    }

    @Test
    @DisplayName("Should reject empty, invalid, non-object and nameless input")
    void rejectsUnusableInput() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{not json"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[{\"name\": \"x\"}]"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"producer\": \"Krug\"}"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"name\": \"   \"}"));
    }

    @Test
    @DisplayName("stripCodeFence leaves bare JSON untouched")
    void stripCodeFenceBare() {
        assertEquals("{\"a\":1}", ExtractedWineParser.stripCodeFence("  {\"a\":1}\n"));
    }
}
