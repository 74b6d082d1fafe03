package com.wine.resolution.merge;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.GrapeVariety;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Copies authoritative values from a matched catalog record into an unresolved record.
 * Only empty fields are filled; values the caller supplied are never overwritten.
 * Grape varieties are taken as a whole list when the unresolved list is empty.
 */
public class EnrichmentMerger {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentMerger.class);

    public UnresolvedWineRecord enrich(UnresolvedWineRecord unresolved, CanonicalWineRecord matched) {
        return enrichWithDetails(unresolved, matched).record();
    }

    public EnrichmentResult enrichWithDetails(UnresolvedWineRecord unresolved, CanonicalWineRecord matched) {
        Objects.requireNonNull(unresolved, "unresolved is required");
        if (matched == null) {
            return EnrichmentResult.unchanged(unresolved);
        }

        UnresolvedWineRecord.Builder builder = unresolved.toBuilder();
        List<String> filled = new ArrayList<>();

        fillText("producer", unresolved.getProducer(), matched.getProducer(), builder::producer, filled);
        fillText("region", unresolved.getRegion(), matched.getRegion(), builder::region, filled);
        fillText("appellation", unresolved.getAppellation(), matched.getAppellation(), builder::appellation, filled);
        fillText("country", unresolved.getCountry(), matched.getCountry(), builder::country, filled);
        fillText("classification", unresolved.getClassification(), matched.getClassification(),
                builder::classification, filled);
        fillGrapes(unresolved.getGrapeVarieties(), matched.getGrapeVarieties(), builder, filled);
        fillText("lwin7", unresolved.getLwin7(), matched.getLwin7(), builder::lwin7, filled);
        fillText("lwin11", unresolved.getLwin11(), matched.getLwin11(), builder::lwin11, filled);
        fillText("lwin18", unresolved.getLwin18(), matched.getLwin18(), builder::lwin18, filled);

        if (filled.isEmpty()) {
            return new EnrichmentResult(unresolved, matched, List.of());
        }
        log.debug("enrich.filled name='{}' matchedId={} fields={}", unresolved.getName(), matched.getId(), filled);
        return new EnrichmentResult(builder.build(), matched, filled);
    }

    private static void fillText(String field, String current, String source,
                                 Consumer<String> setter, List<String> filled) {
        if (isEmpty(current) && !isEmpty(source)) {
            setter.accept(source);
            filled.add(field);
        }
    }

    private static void fillGrapes(List<GrapeVariety> current, List<GrapeVariety> source,
                                   UnresolvedWineRecord.Builder builder, List<String> filled) {
        if (current.isEmpty() && !source.isEmpty()) {
            builder.grapeVarieties(source);
            filled.add("grapeVarieties");
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
