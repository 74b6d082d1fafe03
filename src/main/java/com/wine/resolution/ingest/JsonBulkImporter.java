package com.wine.resolution.ingest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * JSON catalog importer.
 *
 * <p>Accepts JSON Lines, one object per line:</p>
 * <pre>
 * {"LWIN": "1023456", "WINE": "Chateau Margaux", "COUNTRY": "France"}
 * {"LWIN": "1012345", "WINE": "Grande Cuvee", "PRODUCER_NAME": "Krug"}
 * </pre>
 *
 * <p>or a top-level array of the same objects. Scalar values are imported as text, arrays
 * as a comma-separated list and nulls as absent columns.</p>
 */
public class JsonBulkImporter implements BulkImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonBulkImporter.class);

    private final CatalogImportService importService;
    private final ObjectMapper objectMapper;

    public JsonBulkImporter(CatalogImportService importService) {
        this(importService, new ObjectMapper());
    }

    public JsonBulkImporter(CatalogImportService importService, ObjectMapper objectMapper) {
        this.importService = importService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportResult importCatalog(InputStream input, ProgressCallback callback) {
        return importCatalog(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ImportResult importCatalog(Reader reader, ProgressCallback callback) {
        List<Map<String, String>> rows;
        try (reader) {
            rows = readRows(reader);
        } catch (IOException e) {
            log.error("import.failed format=json error={}", e.getMessage());
            throw new CatalogImportException("Unable to read JSON source: " + e.getMessage(), e);
        }
        return importService.importRows(rows, getFormat(), callback);
    }

    @Override
    public String getFormat() {
        return "json";
    }

    List<Map<String, String>> readRows(Reader reader) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (JsonParser parser = objectMapper.getFactory().createParser(reader)) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.START_ARRAY) {
                token = parser.nextToken();
            }
            while (token != null && token != JsonToken.END_ARRAY) {
                JsonNode node = objectMapper.readTree(parser);
                if (node == null || !node.isObject()) {
                    throw new IOException("Expected a JSON object for entry " + (rows.size() + 1)
                            + ", got " + (node == null ? "nothing" : node.getNodeType()));
                }
                rows.add(toRow(node));
                token = parser.nextToken();
            }
        }
        return rows;
    }

    private static Map<String, String> toRow(JsonNode node) {
        Map<String, String> row = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = toText(field.getValue());
            if (value != null) {
                row.put(field.getKey(), value);
            }
        }
        return row;
    }

    private static String toText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isArray()) {
            StringJoiner joined = new StringJoiner(", ");
            for (JsonNode element : value) {
                String text = toText(element);
                if (text != null) {
                    joined.add(text);
                }
            }
            return joined.toString();
        }
        if (value.isObject()) {
            return value.toString();
        }
        return value.asText();
    }
}
