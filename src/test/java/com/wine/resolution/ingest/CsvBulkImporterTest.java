package com.wine.resolution.ingest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CsvBulkImporterTest {

    @Mock
    private CatalogImportService importService;

    @Captor
    private ArgumentCaptor<List<Map<String, String>>> rowsCaptor;

    private CsvBulkImporter importer;

    @BeforeEach
    void setUp() {
        importer = new CsvBulkImporter(importService);
    }

    private List<Map<String, String>> importAndCapture(String csv) {
        when(importService.importRows(anyList(), eq("csv"), any())).thenReturn(ImportResult.empty());
        importer.importCatalog(new StringReader(csv), ProgressCallback.NOOP);
        verify(importService).importRows(rowsCaptor.capture(), eq("csv"), any());
        return rowsCaptor.getValue();
    }

    @Test
    @DisplayName("Should key rows by header")
    void testHeaderRow() {
        List<Map<String, String>> rows = importAndCapture("""
                LWIN,WINE,COUNTRY
                1023456,Chateau Margaux,France
                1012345,Grande Cuvee,France
                """);

        assertEquals(2, rows.size());
        assertEquals(Map.of("LWIN", "1023456", "WINE", "Chateau Margaux", "COUNTRY", "France"), rows.get(0));
    }

    @Test
    @DisplayName("Should handle quoted values with commas, quotes and line breaks")
    void testQuotedValues() {
        List<Map<String, String>> rows = importAndCapture(
                "LWIN,WINE,COLOUR\r\n1012345,\"Krug \"\"Grande\"\" Cuvee\",\"Sparkling, white\"\r\n"
                        + "1000001,\"Two\nLines\",Red\r\n");

        assertEquals(2, rows.size());
        assertEquals("Krug \"Grande\" Cuvee", rows.get(0).get("WINE"));
        assertEquals("Sparkling, white", rows.get(0).get("COLOUR"));
        assertEquals("Two\nLines", rows.get(1).get("WINE"));
    }

    @Test
    @DisplayName("Should skip blank lines and keep empty cells")
    void testBlankLines() {
        List<Map<String, String>> rows = importAndCapture("""
                LWIN,WINE,REGION
                1023456,Chateau Margaux,

                ,,
                1012345,,Champagne
                """);

        assertEquals(2, rows.size());
        assertEquals("", rows.get(0).get("REGION"));
        assertEquals("Champagne", rows.get(1).get("REGION"));
    }

    @Test
    @DisplayName("Should strip a byte order mark from the header")
    void testBom() {
        List<Map<String, String>> rows = importAndCapture("\uFEFFLWIN,WINE\n1023456,Margaux");

        assertEquals("1023456", rows.get(0).get("LWIN"));
    }

    @Test
    @DisplayName("Should read UTF-8 streams")
    void testInputStream() {
        when(importService.importRows(anyList(), eq("csv"), any())).thenReturn(ImportResult.empty());
        byte[] bytes = "WINE,COLOUR\nCôte-Rôtie,Rouge\n".getBytes(StandardCharsets.UTF_8);

        importer.importCatalog(new ByteArrayInputStream(bytes), null);

        verify(importService).importRows(rowsCaptor.capture(), eq("csv"), any());
        assertEquals("Côte-Rôtie", rowsCaptor.getValue().get(0).get("WINE"));
    }

    @Test
    @DisplayName("Header-only input imports nothing")
    void testHeaderOnly() {
        assertTrue(importAndCapture("LWIN,WINE\n").isEmpty());
    }

    @Test
    @DisplayName("Unreadable source aborts the import")
    void testUnreadableSource() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };

        CatalogImportException e = assertThrows(CatalogImportException.class,
                () -> importer.importCatalog(failing, ProgressCallback.NOOP));
        assertTrue(e.getMessage().contains("disk gone"));
        verifyNoInteractions(importService);
    }

    @Test
    @DisplayName("Unterminated quotes are a source error")
    void testUnterminatedQuote() throws IOException {
        assertThrows(IOException.class,
                () -> CsvBulkImporter.readRows(new BufferedReader(new StringReader("WINE\n\"Margaux\n"))));
        assertEquals("csv", importer.getFormat());
    }
}
