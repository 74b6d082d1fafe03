package com.wine.resolution.rules;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.DataSource;
import com.wine.resolution.core.model.WineCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps one reference-dataset row (arbitrary column naming) to a catalog record.
 *
 * <p>The dataset carries a single base identity code. Codes are derived from it:</p>
 * <ul>
 *   <li>lwin7 is its first 7 characters</li>
 *   <li>lwin11 is lwin7 followed by the vintage, or the first 11 characters of a longer base</li>
 *   <li>lwin18 is the first 18 characters of a base that long</li>
 * </ul>
 */
public class CatalogRowMapper {
    private static final Logger log = LoggerFactory.getLogger(CatalogRowMapper.class);

    private final FieldNormalizer normalizer;

    public CatalogRowMapper() {
        this(new FieldNormalizer());
    }

    public CatalogRowMapper(FieldNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Maps a row to a record.
     *
     * @return empty if the row has neither a name nor an identity code
     * @throws IllegalArgumentException if a derived identity code is malformed
     */
    public Optional<CanonicalWineRecord> map(Map<String, String> row, DataSource dataSource) {
        String base = CatalogColumn.LWIN.read(row);
        Integer vintage = normalizer.parseVintage(CatalogColumn.VINTAGE.read(row));

        String lwin7 = base != null && base.length() >= 7 ? base.substring(0, 7) : base;
        String lwin11 = null;
        String lwin18 = null;
        if (lwin7 != null && vintage != null) {
            lwin11 = lwin7 + vintage;
        }
        if (base != null && base.length() >= 11) {
            lwin11 = base.substring(0, 11);
        }
        if (base != null && base.length() >= 18) {
            lwin18 = base.substring(0, 18);
        }

        String name = CatalogColumn.NAME.read(row);
        String producer = CatalogColumn.PRODUCER.read(row);
        if (name == null && lwin7 == null) {
            return Optional.empty();
        }
        if (name == null) {
            name = syntheticName(producer, vintage, lwin7);
        }

        String rawCategory = CatalogColumn.CATEGORY.read(row);
        Optional<WineCategory> category = normalizer.classifyCategory(rawCategory);

        CanonicalWineRecord record = CanonicalWineRecord.builder()
                .lwin7(lwin7)
                .lwin11(lwin11)
                .lwin18(lwin18)
                .name(name)
                .producer(producer)
                .vintage(vintage)
                .country(CatalogColumn.COUNTRY.read(row))
                .region(CatalogColumn.REGION.read(row))
                .category(category.orElse(DefaultCategoryRules.FALLBACK), category.isEmpty())
                .alcoholContent(normalizer.parseAlcohol(CatalogColumn.ALCOHOL.read(row)))
                .grapeVarieties(normalizer.parseGrapeList(CatalogColumn.GRAPES.read(row)))
                .lwinStatus(CatalogColumn.STATUS.read(row))
                .displayName(CatalogColumn.DISPLAY_NAME.read(row))
                .producerTitle(CatalogColumn.PRODUCER_TITLE.read(row))
                .subRegion(CatalogColumn.SUB_REGION.read(row))
                .site(CatalogColumn.SITE.read(row))
                .parcel(CatalogColumn.PARCEL.read(row))
                .subType(CatalogColumn.SUB_TYPE.read(row))
                .designation(CatalogColumn.DESIGNATION.read(row))
                .classification(CatalogColumn.CLASSIFICATION.read(row))
                .vintageConfig(CatalogColumn.VINTAGE_CONFIG.read(row))
                .firstVintage(CatalogColumn.FIRST_VINTAGE.read(row))
                .finalVintage(CatalogColumn.FINAL_VINTAGE.read(row))
                .lwinReference(CatalogColumn.REFERENCE.read(row))
                .lwinDateAdded(parseDate(CatalogColumn.DATE_ADDED.read(row)))
                .lwinDateUpdated(parseDate(CatalogColumn.DATE_UPDATED.read(row)))
                .dataSource(dataSource)
                .build();
        return Optional.of(record);
    }

    static String syntheticName(String producer, Integer vintage, String lwin7) {
        List<String> parts = new ArrayList<>(2);
        if (producer != null) {
            parts.add(producer);
        }
        if (vintage != null) {
            parts.add(String.valueOf(vintage));
        }
        return parts.isEmpty() ? "Wine " + lwin7 : String.join(" ", parts);
    }

    /**
     * Accepts "2019-03-14 10:22:00", ISO-8601 date-times and plain dates.
     */
    static LocalDateTime parseDate(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            if (raw.length() == 10) {
                return LocalDate.parse(raw).atStartOfDay();
            }
            return LocalDateTime.parse(raw.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            log.debug("Dropping unparseable date '{}'", raw);
            return null;
        }
    }
}
