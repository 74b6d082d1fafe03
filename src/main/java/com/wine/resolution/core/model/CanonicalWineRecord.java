package com.wine.resolution.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Authoritative wine catalog entry.
 * Catalog-sourced records have no {@code owner}; user-private copies carry one and are
 * never considered by lookups in this library.
 *
 * <p>Identity codes are format-checked on every write (see {@link LwinCode}).</p>
 */
public class CanonicalWineRecord {
    private final String id;

    private String lwin7;
    private String lwin11;
    private String lwin18;

    private String name;
    private String producer;
    private String producerTitle;
    private Integer vintage;
    private String country;
    private String region;
    private String subRegion;
    private String appellation;
    private String designation;
    private String classification;
    private WineCategory category;
    private boolean categoryInferred;
    private List<GrapeVariety> grapeVarieties;
    private Double alcoholContent;

    private String lwinStatus;
    private String displayName;
    private String site;
    private String parcel;
    private String subType;
    private String vintageConfig;
    private String firstVintage;
    private String finalVintage;
    private String lwinReference;
    private LocalDateTime lwinDateAdded;
    private LocalDateTime lwinDateUpdated;

    private DataSource dataSource;
    private String owner;
    private Instant lastSynced;
    private final Instant createdAt;
    private Instant updatedAt;

    private CanonicalWineRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.lwin7 = LwinCode.LWIN7.validate(builder.lwin7);
        this.lwin11 = LwinCode.LWIN11.validate(builder.lwin11);
        this.lwin18 = LwinCode.LWIN18.validate(builder.lwin18);
        this.name = builder.name;
        this.producer = builder.producer;
        this.producerTitle = builder.producerTitle;
        this.vintage = builder.vintage;
        this.country = builder.country;
        this.region = builder.region;
        this.subRegion = builder.subRegion;
        this.appellation = builder.appellation;
        this.designation = builder.designation;
        this.classification = builder.classification;
        this.category = builder.category != null ? builder.category : WineCategory.RED;
        this.categoryInferred = builder.category == null || builder.categoryInferred;
        this.grapeVarieties = builder.grapeVarieties != null ? List.copyOf(builder.grapeVarieties) : List.of();
        this.alcoholContent = builder.alcoholContent;
        this.lwinStatus = builder.lwinStatus;
        this.displayName = builder.displayName;
        this.site = builder.site;
        this.parcel = builder.parcel;
        this.subType = builder.subType;
        this.vintageConfig = builder.vintageConfig;
        this.firstVintage = builder.firstVintage;
        this.finalVintage = builder.finalVintage;
        this.lwinReference = builder.lwinReference;
        this.lwinDateAdded = builder.lwinDateAdded;
        this.lwinDateUpdated = builder.lwinDateUpdated;
        this.dataSource = builder.dataSource != null ? builder.dataSource : DataSource.CATALOG_IMPORT;
        this.owner = builder.owner;
        this.lastSynced = builder.lastSynced;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getLwin7() {
        return lwin7;
    }

    public void setLwin7(String lwin7) {
        this.lwin7 = LwinCode.LWIN7.validate(lwin7);
    }

    public String getLwin11() {
        return lwin11;
    }

    public void setLwin11(String lwin11) {
        this.lwin11 = LwinCode.LWIN11.validate(lwin11);
    }

    public String getLwin18() {
        return lwin18;
    }

    public void setLwin18(String lwin18) {
        this.lwin18 = LwinCode.LWIN18.validate(lwin18);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name is required");
    }

    public String getProducer() {
        return producer;
    }

    public void setProducer(String producer) {
        this.producer = producer;
    }

    public String getProducerTitle() {
        return producerTitle;
    }

    public void setProducerTitle(String producerTitle) {
        this.producerTitle = producerTitle;
    }

    public Integer getVintage() {
        return vintage;
    }

    public void setVintage(Integer vintage) {
        this.vintage = vintage;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getSubRegion() {
        return subRegion;
    }

    public void setSubRegion(String subRegion) {
        this.subRegion = subRegion;
    }

    public String getAppellation() {
        return appellation;
    }

    public void setAppellation(String appellation) {
        this.appellation = appellation;
    }

    public String getDesignation() {
        return designation;
    }

    public void setDesignation(String designation) {
        this.designation = designation;
    }

    public String getClassification() {
        return classification;
    }

    public void setClassification(String classification) {
        this.classification = classification;
    }

    public WineCategory getCategory() {
        return category;
    }

    /**
     * True when {@link #getCategory()} is the red fallback rather than a recognised label.
     */
    public boolean isCategoryInferred() {
        return categoryInferred;
    }

    public void setCategory(WineCategory category, boolean inferred) {
        this.category = Objects.requireNonNull(category, "category is required");
        this.categoryInferred = inferred;
    }

    public List<GrapeVariety> getGrapeVarieties() {
        return grapeVarieties;
    }

    public void setGrapeVarieties(List<GrapeVariety> grapeVarieties) {
        this.grapeVarieties = grapeVarieties != null ? List.copyOf(grapeVarieties) : List.of();
    }

    public Double getAlcoholContent() {
        return alcoholContent;
    }

    public void setAlcoholContent(Double alcoholContent) {
        this.alcoholContent = alcoholContent;
    }

    public String getLwinStatus() {
        return lwinStatus;
    }

    public void setLwinStatus(String lwinStatus) {
        this.lwinStatus = lwinStatus;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public String getParcel() {
        return parcel;
    }

    public void setParcel(String parcel) {
        this.parcel = parcel;
    }

    public String getSubType() {
        return subType;
    }

    public void setSubType(String subType) {
        this.subType = subType;
    }

    public String getVintageConfig() {
        return vintageConfig;
    }

    public void setVintageConfig(String vintageConfig) {
        this.vintageConfig = vintageConfig;
    }

    public String getFirstVintage() {
        return firstVintage;
    }

    public void setFirstVintage(String firstVintage) {
        this.firstVintage = firstVintage;
    }

    public String getFinalVintage() {
        return finalVintage;
    }

    public void setFinalVintage(String finalVintage) {
        this.finalVintage = finalVintage;
    }

    public String getLwinReference() {
        return lwinReference;
    }

    public void setLwinReference(String lwinReference) {
        this.lwinReference = lwinReference;
    }

    public LocalDateTime getLwinDateAdded() {
        return lwinDateAdded;
    }

    public void setLwinDateAdded(LocalDateTime lwinDateAdded) {
        this.lwinDateAdded = lwinDateAdded;
    }

    public LocalDateTime getLwinDateUpdated() {
        return lwinDateUpdated;
    }

    public void setLwinDateUpdated(LocalDateTime lwinDateUpdated) {
        this.lwinDateUpdated = lwinDateUpdated;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public void setDataSource(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
    }

    public String getOwner() {
        return owner;
    }

    public boolean isCanonical() {
        return owner == null;
    }

    public Instant getLastSynced() {
        return lastSynced;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Stamps both the sync and update timestamps.
     */
    public void markSynced(Instant now) {
        this.lastSynced = now;
        this.updatedAt = now;
    }

    /**
     * Returns a detached copy with the same id.
     */
    public CanonicalWineRecord copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalWineRecord that = (CanonicalWineRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalWineRecord{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", producer='" + producer + '\'' +
                ", vintage=" + vintage +
                ", lwin7='" + lwin7 + '\'' +
                ", lwin11='" + lwin11 + '\'' +
                ", dataSource=" + dataSource +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CanonicalWineRecord record) {
        return new Builder()
                .id(record.id)
                .lwin7(record.lwin7)
                .lwin11(record.lwin11)
                .lwin18(record.lwin18)
                .name(record.name)
                .producer(record.producer)
                .producerTitle(record.producerTitle)
                .vintage(record.vintage)
                .country(record.country)
                .region(record.region)
                .subRegion(record.subRegion)
                .appellation(record.appellation)
                .designation(record.designation)
                .classification(record.classification)
                .category(record.category, record.categoryInferred)
                .grapeVarieties(record.grapeVarieties)
                .alcoholContent(record.alcoholContent)
                .lwinStatus(record.lwinStatus)
                .displayName(record.displayName)
                .site(record.site)
                .parcel(record.parcel)
                .subType(record.subType)
                .vintageConfig(record.vintageConfig)
                .firstVintage(record.firstVintage)
                .finalVintage(record.finalVintage)
                .lwinReference(record.lwinReference)
                .lwinDateAdded(record.lwinDateAdded)
                .lwinDateUpdated(record.lwinDateUpdated)
                .dataSource(record.dataSource)
                .owner(record.owner)
                .lastSynced(record.lastSynced)
                .createdAt(record.createdAt)
                .updatedAt(record.updatedAt);
    }

    public static class Builder {
        private String id;
        private String lwin7;
        private String lwin11;
        private String lwin18;
        private String name;
        private String producer;
        private String producerTitle;
        private Integer vintage;
        private String country;
        private String region;
        private String subRegion;
        private String appellation;
        private String designation;
        private String classification;
        private WineCategory category;
        private boolean categoryInferred;
        private List<GrapeVariety> grapeVarieties;
        private Double alcoholContent;
        private String lwinStatus;
        private String displayName;
        private String site;
        private String parcel;
        private String subType;
        private String vintageConfig;
        private String firstVintage;
        private String finalVintage;
        private String lwinReference;
        private LocalDateTime lwinDateAdded;
        private LocalDateTime lwinDateUpdated;
        private DataSource dataSource;
        private String owner;
        private Instant lastSynced;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
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

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder producer(String producer) {
            this.producer = producer;
            return this;
        }

        public Builder producerTitle(String producerTitle) {
            this.producerTitle = producerTitle;
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

        public Builder subRegion(String subRegion) {
            this.subRegion = subRegion;
            return this;
        }

        public Builder appellation(String appellation) {
            this.appellation = appellation;
            return this;
        }

        public Builder designation(String designation) {
            this.designation = designation;
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public Builder category(WineCategory category) {
            return category(category, false);
        }

        public Builder category(WineCategory category, boolean inferred) {
            this.category = category;
            this.categoryInferred = inferred;
            return this;
        }

        public Builder grapeVarieties(List<GrapeVariety> grapeVarieties) {
            this.grapeVarieties = grapeVarieties;
            return this;
        }

        public Builder alcoholContent(Double alcoholContent) {
            this.alcoholContent = alcoholContent;
            return this;
        }

        public Builder lwinStatus(String lwinStatus) {
            this.lwinStatus = lwinStatus;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder site(String site) {
            this.site = site;
            return this;
        }

        public Builder parcel(String parcel) {
            this.parcel = parcel;
            return this;
        }

        public Builder subType(String subType) {
            this.subType = subType;
            return this;
        }

        public Builder vintageConfig(String vintageConfig) {
            this.vintageConfig = vintageConfig;
            return this;
        }

        public Builder firstVintage(String firstVintage) {
            this.firstVintage = firstVintage;
            return this;
        }

        public Builder finalVintage(String finalVintage) {
            this.finalVintage = finalVintage;
            return this;
        }

        public Builder lwinReference(String lwinReference) {
            this.lwinReference = lwinReference;
            return this;
        }

        public Builder lwinDateAdded(LocalDateTime lwinDateAdded) {
            this.lwinDateAdded = lwinDateAdded;
            return this;
        }

        public Builder lwinDateUpdated(LocalDateTime lwinDateUpdated) {
            this.lwinDateUpdated = lwinDateUpdated;
            return this;
        }

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder lastSynced(Instant lastSynced) {
            this.lastSynced = lastSynced;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CanonicalWineRecord build() {
            Objects.requireNonNull(name, "name is required");
            return new CanonicalWineRecord(this);
        }
    }
}
