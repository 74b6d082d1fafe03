package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;

import java.util.function.Function;

/**
 * Queryable fields of a catalog record. Store implementations translate these to
 * their own field names; {@link #fieldName()} is the document field name.
 */
public enum CatalogField {
    LWIN7("lwin7", CanonicalWineRecord::getLwin7),
    LWIN11("lwin11", CanonicalWineRecord::getLwin11),
    LWIN18("lwin18", CanonicalWineRecord::getLwin18),
    NAME("name", CanonicalWineRecord::getName),
    PRODUCER("producer", CanonicalWineRecord::getProducer),
    PRODUCER_TITLE("producer_title", CanonicalWineRecord::getProducerTitle),
    VINTAGE("vintage", CanonicalWineRecord::getVintage),
    COUNTRY("country", CanonicalWineRecord::getCountry),
    REGION("region", CanonicalWineRecord::getRegion),
    SUB_REGION("sub_region", CanonicalWineRecord::getSubRegion),
    APPELLATION("appellation", CanonicalWineRecord::getAppellation),
    DESIGNATION("designation", CanonicalWineRecord::getDesignation),
    CATEGORY("wine_type", CanonicalWineRecord::getCategory),
    DATA_SOURCE("data_source", CanonicalWineRecord::getDataSource),
    OWNER("user_id", CanonicalWineRecord::getOwner);

    private final String fieldName;
    private final Function<CanonicalWineRecord, Object> accessor;

    CatalogField(String fieldName, Function<CanonicalWineRecord, Object> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    public String fieldName() {
        return fieldName;
    }

    public Object valueOf(CanonicalWineRecord record) {
        return accessor.apply(record);
    }
}
