package com.wine.resolution.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wine.resolution.core.model.DataSource;
import com.wine.resolution.core.model.GrapeVariety;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import com.wine.resolution.rules.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the structured JSON produced by label extraction into an {@link UnresolvedWineRecord}.
 *
 * <pre>
 * {
 *   "name": "Chateau Margaux",
 *   "producer": "Chateau Margaux",
 *   "vintage": 2015,
 *   "wine_type": "red",
 *   "alcohol_content": "13.5%",
 *   "grape_varieties": [{"name": "Cabernet Sauvignon", "percentage": 87}, "Merlot"],
 *   "suggested_lwin7": "1023456",
 *   "confidence_score": 0.92
 * }
 * </pre>
 *
 * <p>Markdown code fences around the JSON are ignored. Loosely typed values go through the
 * {@link FieldNormalizer}: a malformed vintage or alcohol value is dropped, not an error.
 * An unknown wine type leaves the category empty.</p>
 */
public class ExtractedWineParser {
    private static final Logger log = LoggerFactory.getLogger(ExtractedWineParser.class);

    private final ObjectMapper objectMapper;
    private final FieldNormalizer normalizer;

    public ExtractedWineParser() {
        this(new ObjectMapper(), new FieldNormalizer());
    }

    public ExtractedWineParser(ObjectMapper objectMapper, FieldNormalizer normalizer) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object or has no name
     */
    public UnresolvedWineRecord parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Extraction output is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Extraction output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Extraction output must be a JSON object");
        }
        return toRecord(root);
    }

    UnresolvedWineRecord toRecord(JsonNode root) {
        String name = text(root, "name");
        if (name == null) {
            throw new IllegalArgumentException("Extraction output has no wine name");
        }

        UnresolvedWineRecord record = UnresolvedWineRecord.builder(name)
                .producer(text(root, "producer"))
                .vintage(normalizer.parseVintage(text(root, "vintage")))
                .country(text(root, "country"))
                .region(text(root, "region"))
                .appellation(text(root, "appellation"))
                .classification(text(root, "classification"))
                .category(normalizer.classifyCategory(text(root, "wine_type")).orElse(null))
                .alcoholContent(normalizer.parseAlcohol(text(root, "alcohol_content")))
                .grapeVarieties(grapes(root.get("grape_varieties")))
                .suggestedLwin(text(root, "suggested_lwin7"))
                .confidenceScore(confidence(root.get("confidence_score")))
                .dataSource(DataSource.AI_EXTRACTED)
                .build();
        log.debug("extraction.parsed name='{}' suggestedLwin={}", record.getName(), record.getSuggestedLwin());
        return record;
    }

    /**
     * Accepts a list of names, a list of {name, percentage} objects (mixed is fine) or a
     * comma-separated string. Entries without a usable name are skipped.
     */
    private List<GrapeVariety> grapes(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return normalizer.parseGrapeList(node.asText());
        }
        List<GrapeVariety> grapes = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && !element.asText().isBlank()) {
                    grapes.add(GrapeVariety.of(element.asText().trim()));
                } else if (element.isObject()) {
                    String grapeName = text(element, "name");
                    if (grapeName != null) {
                        grapes.add(new GrapeVariety(grapeName, percentage(element.get("percentage"))));
                    }
                }
            }
        }
        return grapes;
    }

    private static Double percentage(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        return value >= 0 && value <= 100 ? value : null;
    }

    private static Double confidence(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstLineEnd = text.indexOf('\n');
        if (firstLineEnd < 0) {
            return text;
        }
        text = text.substring(firstLineEnd + 1);
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.trim();
    }
}
