package com.wine.resolution.catalog;

import com.wine.resolution.core.model.WineCategory;

/**
 * Browse query over the reference catalog. All criteria are optional and combined with AND.
 */
public class CatalogSearchQuery {

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 100;

    private final String text;
    private final String country;
    private final String region;
    private final WineCategory category;
    private final Integer vintage;
    private final int skip;
    private final int limit;

    private CatalogSearchQuery(Builder builder) {
        this.text = builder.text;
        this.country = builder.country;
        this.region = builder.region;
        this.category = builder.category;
        this.vintage = builder.vintage;
        this.skip = builder.skip;
        this.limit = builder.limit;
    }

    /**
     * Free text matched as a substring of name or producer.
     */
    public String getText() {
        return text;
    }

    public String getCountry() {
        return country;
    }

    public String getRegion() {
        return region;
    }

    public WineCategory getCategory() {
        return category;
    }

    public Integer getVintage() {
        return vintage;
    }

    public int getSkip() {
        return skip;
    }

    public int getLimit() {
        return limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private String country;
        private String region;
        private WineCategory category;
        private Integer vintage;
        private int skip = 0;
        private int limit = DEFAULT_LIMIT;

        public Builder text(String text) {
            this.text = text;
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

        public Builder category(WineCategory category) {
            this.category = category;
            return this;
        }

        public Builder vintage(Integer vintage) {
            this.vintage = vintage;
            return this;
        }

        public Builder skip(int skip) {
            if (skip < 0) {
                throw new IllegalArgumentException("skip must be >= 0");
            }
            this.skip = skip;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
            }
            this.limit = limit;
            return this;
        }

        public CatalogSearchQuery build() {
            return new CatalogSearchQuery(this);
        }
    }
}
