package com.wine.resolution.rules;

import java.util.List;
import java.util.Map;

/**
 * Logical fields of a reference-dataset row and the column names accepted for each,
 * tried in order.
 */
public enum CatalogColumn {
    LWIN("LWIN", "lwin", "lwin7", "LWIN7", "lwin_7"),
    NAME("WINE", "name", "Name"),
    PRODUCER("PRODUCER_NAME", "producer"),
    VINTAGE("vintage", "Vintage", "year", "Year", "FIRST_VINTAGE"),
    COUNTRY("COUNTRY", "country"),
    REGION("REGION", "region"),
    CATEGORY("COLOUR", "TYPE", "type"),
    ALCOHOL("alcohol", "Alcohol", "alcohol_content", "ABV"),
    GRAPES("grapes", "Grapes", "grape_variety", "Grape Variety"),

    STATUS("STATUS"),
    DISPLAY_NAME("DISPLAY_NAME"),
    PRODUCER_TITLE("PRODUCER_TITLE"),
    SUB_REGION("SUB_REGION"),
    SITE("SITE"),
    PARCEL("PARCEL"),
    SUB_TYPE("SUB_TYPE"),
    DESIGNATION("DESIGNATION"),
    CLASSIFICATION("CLASSIFICATION"),
    VINTAGE_CONFIG("VINTAGE_CONFIG"),
    FIRST_VINTAGE("FIRST_VINTAGE"),
    FINAL_VINTAGE("FINAL_VINTAGE"),
    REFERENCE("REFERENCE"),
    DATE_ADDED("DATE_ADDED"),
    DATE_UPDATED("DATE_UPDATED");

    private final List<String> aliases;

    CatalogColumn(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Reads this field from a row; absent or blank columns yield null.
     */
    public String read(Map<String, String> row) {
        return FieldNormalizer.resolveField(row, aliases);
    }
}
