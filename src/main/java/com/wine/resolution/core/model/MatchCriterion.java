package com.wine.resolution.core.model;

/**
 * Scoring criteria applied when comparing an unresolved record to a catalog candidate.
 * Tiers of the same {@link Field} are mutually exclusive: only the highest applicable
 * tier contributes.
 */
public enum MatchCriterion {
    NAME_EXACT(Field.NAME, "name_exact", 40),
    NAME_CONTAINS(Field.NAME, "name_partial", 30),
    NAME_SHARED_WORD(Field.NAME, "name_word", 20),
    PRODUCER_EXACT(Field.PRODUCER, "producer_exact", 25),
    PRODUCER_CONTAINS(Field.PRODUCER, "producer_partial", 20),
    VINTAGE_EXACT(Field.VINTAGE, "vintage_exact", 15),
    VINTAGE_ADJACENT(Field.VINTAGE, "vintage_close", 5),
    REGION(Field.REGION, "region", 10),
    SUB_REGION(Field.REGION, "sub_region", 8),
    APPELLATION(Field.APPELLATION, "appellation", 5),
    DESIGNATION(Field.APPELLATION, "designation", 3),
    COUNTRY(Field.COUNTRY, "country", 5);

    /**
     * Field a criterion belongs to.
     */
    public enum Field { NAME, PRODUCER, VINTAGE, REGION, APPELLATION, COUNTRY }

    private final Field field;
    private final String tag;
    private final int points;

    MatchCriterion(Field field, String tag, int points) {
        this.field = field;
        this.tag = tag;
        this.points = points;
    }

    public Field field() {
        return field;
    }

    public String tag() {
        return tag;
    }

    public int points() {
        return points;
    }
}
