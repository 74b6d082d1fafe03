package com.wine.resolution.ingest;

import com.wine.resolution.core.model.DataSource;

import java.util.Objects;

/**
 * Options for catalog imports.
 */
public class ImportOptions {

    private static final int DEFAULT_BATCH_SIZE = 100;

    private final int batchSize;
    private final DataSource dataSource;

    private ImportOptions(Builder builder) {
        this.batchSize = builder.batchSize;
        this.dataSource = builder.dataSource;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Provenance stamped on every imported record.
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private DataSource dataSource = DataSource.CATALOG_IMPORT;

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ImportOptions{batchSize=" + batchSize + ", dataSource=" + dataSource + '}';
    }
}
