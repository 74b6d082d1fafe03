package com.wine.resolution.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV catalog importer.
 *
 * <p>Expected format: a header row naming the columns, then one wine per row.</p>
 * <pre>
 * LWIN,PRODUCER_NAME,WINE,COUNTRY,REGION,COLOUR,FIRST_VINTAGE
 * 1023456,Chateau Margaux,Chateau Margaux,France,Bordeaux,Red,1900
 * 1012345,"Krug",Grande Cuvee,France,Champagne,"Sparkling, white",
 * </pre>
 *
 * <p>Fields may be quoted; quoted fields may contain commas, line breaks and doubled quotes.
 * Rows whose fields are all blank are ignored.</p>
 */
public class CsvBulkImporter implements BulkImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvBulkImporter.class);
    private static final char BOM = '\uFEFF';

    private final CatalogImportService importService;

    public CsvBulkImporter(CatalogImportService importService) {
        this.importService = importService;
    }

    @Override
    public ImportResult importCatalog(InputStream input, ProgressCallback callback) {
        return importCatalog(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ImportResult importCatalog(Reader reader, ProgressCallback callback) {
        List<Map<String, String>> rows;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            rows = readRows(br);
        } catch (IOException e) {
            log.error("import.failed format=csv error={}", e.getMessage());
            throw new CatalogImportException("Unable to read CSV source: " + e.getMessage(), e);
        }
        return importService.importRows(rows, getFormat(), callback);
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static List<Map<String, String>> readRows(BufferedReader reader) throws IOException {
        List<List<String>> records = parse(reader);
        if (records.isEmpty()) {
            return List.of();
        }
        List<String> header = records.get(0);
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }

        List<Map<String, String>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            List<String> fields = records.get(i);
            if (fields.stream().allMatch(String::isBlank)) {
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size() && c < fields.size(); c++) {
                row.put(header.get(c).trim(), fields.get(c));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Splits the whole input into records of fields.
     */
    private static List<List<String>> parse(BufferedReader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean pendingRecord = false;

        int ch;
        while ((ch = reader.read()) != -1) {
            char c = (char) ch;
            if (quoted) {
                if (c == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    field.append(c);
                }
                continue;
            }
            switch (c) {
                case '"' -> {
                    quoted = true;
                    pendingRecord = true;
                }
                case ',' -> {
                    current.add(field.toString());
                    field.setLength(0);
                    pendingRecord = true;
                }
                case '\r' -> {
                    // handled with the following \n, or alone as a line break
                    reader.mark(1);
                    if (reader.read() != '\n') {
                        reader.reset();
                    }
                    pendingRecord = endRecord(records, current, field, pendingRecord);
                    current = new ArrayList<>();
                }
                case '\n' -> {
                    pendingRecord = endRecord(records, current, field, pendingRecord);
                    current = new ArrayList<>();
                }
                default -> {
                    field.append(c);
                    pendingRecord = true;
                }
            }
        }
        if (quoted) {
            throw new IOException("Unterminated quoted field at end of input");
        }
        endRecord(records, current, field, pendingRecord);
        return records;
    }

    private static boolean endRecord(List<List<String>> records, List<String> current,
                                     StringBuilder field, boolean pendingRecord) {
        if (pendingRecord) {
            current.add(field.toString());
            records.add(current);
        }
        field.setLength(0);
        return false;
    }
}
