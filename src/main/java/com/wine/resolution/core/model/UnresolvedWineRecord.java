package com.wine.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A partially populated wine record awaiting resolution against the catalog,
 * typically produced by label extraction or a third-party import.
 *
 * <p>Immutable; enrichment produces a new instance via {@link #toBuilder()}.</p>
 */
public final class UnresolvedWineRecord {
    private final String name;
    private final String producer;
    private final Integer vintage;
    private final String country;
    private final String region;
    private final String appellation;
    private final String classification;
    private final WineCategory category;
    private final Double alcoholContent;
    private final List<GrapeVariety> grapeVarieties;
    private final String lwin7;
    private final String lwin11;
    private final String lwin18;
    private final String suggestedLwin;
    private final Double confidenceScore;
    private final DataSource dataSource;

    private UnresolvedWineRecord(Builder builder) {
        this.name = builder.name;
        this.producer = builder.producer;
        this.vintage = builder.vintage;
        this.country = builder.country;
        this.region = builder.region;
        this.appellation = builder.appellation;
        this.classification = builder.classification;
        this.category = builder.category;
        this.alcoholContent = builder.alcoholContent;
        this.grapeVarieties = builder.grapeVarieties != null ? List.copyOf(builder.grapeVarieties) : List.of();
        this.lwin7 = LwinCode.LWIN7.validate(builder.lwin7);
        this.lwin11 = LwinCode.LWIN11.validate(builder.lwin11);
        this.lwin18 = LwinCode.LWIN18.validate(builder.lwin18);
        this.suggestedLwin = builder.suggestedLwin;
        this.confidenceScore = builder.confidenceScore;
        this.dataSource = builder.dataSource != null ? builder.dataSource : DataSource.AI_EXTRACTED;
    }

    public String getName() {
        return name;
    }

    public String getProducer() {
        return producer;
    }

    public Integer getVintage() {
        return vintage;
    }

    public String getCountry() {
        return country;
    }

    public String getRegion() {
        return region;
    }

    public String getAppellation() {
        return appellation;
    }

    public String getClassification() {
        return classification;
    }

    public WineCategory getCategory() {
        return category;
    }

    public Double getAlcoholContent() {
        return alcoholContent;
    }

    public List<GrapeVariety> getGrapeVarieties() {
        return grapeVarieties;
    }

    public String getLwin7() {
        return lwin7;
    }

    public String getLwin11() {
        return lwin11;
    }

    public String getLwin18() {
        return lwin18;
    }

    /**
     * Identity code guessed by the extraction step. Not format-checked: it is a hint,
     * looked up by length and ignored when it matches nothing.
     */
    public String getSuggestedLwin() {
        return suggestedLwin;
    }

    public Double getConfidenceScore() {
        return confidenceScore;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .producer(producer)
                .vintage(vintage)
                .country(country)
                .region(region)
                .appellation(appellation)
                .classification(classification)
                .category(category)
                .alcoholContent(alcoholContent)
                .grapeVarieties(grapeVarieties)
                .lwin7(lwin7)
                .lwin11(lwin11)
                .lwin18(lwin18)
                .suggestedLwin(suggestedLwin)
                .confidenceScore(confidenceScore)
                .dataSource(dataSource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnresolvedWineRecord that = (UnresolvedWineRecord) o;
        return Objects.equals(name, that.name)
                && Objects.equals(producer, that.producer)
                && Objects.equals(vintage, that.vintage)
                && Objects.equals(country, that.country)
                && Objects.equals(region, that.region)
                && Objects.equals(appellation, that.appellation)
                && Objects.equals(classification, that.classification)
                && category == that.category
                && Objects.equals(alcoholContent, that.alcoholContent)
                && Objects.equals(grapeVarieties, that.grapeVarieties)
                && Objects.equals(lwin7, that.lwin7)
                && Objects.equals(lwin11, that.lwin11)
                && Objects.equals(lwin18, that.lwin18)
                && Objects.equals(suggestedLwin, that.suggestedLwin)
                && Objects.equals(confidenceScore, that.confidenceScore)
                && dataSource == that.dataSource;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, producer, vintage, country, region, appellation, lwin7, lwin11, lwin18);
    }

    @Override
    public String toString() {
        return "UnresolvedWineRecord{" +
                "name='" + name + '\'' +
                ", producer='" + producer + '\'' +
                ", vintage=" + vintage +
                ", region='" + region + '\'' +
                ", country='" + country + '\'' +
                ", suggestedLwin='" + suggestedLwin + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public static class Builder {
        private String name;
        private String producer;
        private Integer vintage;
        private String country;
        private String region;
        private String appellation;
        private String classification;
        private WineCategory category;
        private Double alcoholContent;
        private List<GrapeVariety> grapeVarieties;
        private String lwin7;
        private String lwin11;
        private String lwin18;
        private String suggestedLwin;
        private Double confidenceScore;
        private DataSource dataSource;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder producer(String producer) {
            this.producer = producer;
            return this;
        }

        public Builder vintage(Integer vintage) {
            this.vintage = vintage;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder appellation(String appellation) {
            this.appellation = appellation;
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public Builder category(WineCategory category) {
            this.category = category;
            return this;
        }

        public Builder alcoholContent(Double alcoholContent) {
            this.alcoholContent = alcoholContent;
            return this;
        }

        public Builder grapeVarieties(List<GrapeVariety> grapeVarieties) {
            this.grapeVarieties = grapeVarieties;
            return this;
        }

        public Builder lwin7(String lwin7) {
            this.lwin7 = lwin7;
            return this;
        }

        public Builder lwin11(String lwin11) {
            this.lwin11 = lwin11;
            return this;
        }

        public Builder lwin18(String lwin18) {
            this.lwin18 = lwin18;
            return this;
        }

        public Builder suggestedLwin(String suggestedLwin) {
            this.suggestedLwin = suggestedLwin;
            return this;
        }

        public Builder confidenceScore(Double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public UnresolvedWineRecord build() {
            Objects.requireNonNull(name, "name is required");
            return new UnresolvedWineRecord(this);
        }
    }
}
