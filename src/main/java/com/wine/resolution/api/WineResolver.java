package com.wine.resolution.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wine.resolution.cache.CacheConfig;
import com.wine.resolution.cache.CacheStats;
import com.wine.resolution.cache.CaffeineResolutionCache;
import com.wine.resolution.cache.NoOpResolutionCache;
import com.wine.resolution.cache.ResolutionCache;
import com.wine.resolution.catalog.CatalogSearchQuery;
import com.wine.resolution.catalog.CatalogSearchService;
import com.wine.resolution.catalog.CatalogStatistics;
import com.wine.resolution.catalog.CatalogStore;
import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.UnresolvedWineRecord;
import com.wine.resolution.extraction.ExtractedWineParser;
import com.wine.resolution.ingest.CatalogChangeListener;
import com.wine.resolution.ingest.CatalogImportService;
import com.wine.resolution.ingest.CsvBulkImporter;
import com.wine.resolution.ingest.IdentityResolver;
import com.wine.resolution.ingest.ImportOptions;
import com.wine.resolution.ingest.ImportResult;
import com.wine.resolution.ingest.JsonBulkImporter;
import com.wine.resolution.ingest.ProgressCallback;
import com.wine.resolution.matching.CandidateGenerator;
import com.wine.resolution.matching.WineMatchScorer;
import com.wine.resolution.merge.EnrichmentMerger;
import com.wine.resolution.merge.EnrichmentResult;
import com.wine.resolution.metrics.MetricsService;
import com.wine.resolution.metrics.NoOpMetricsService;
import com.wine.resolution.rules.CatalogRowMapper;
import com.wine.resolution.rules.CategoryRule;
import com.wine.resolution.rules.DefaultCategoryRules;
import com.wine.resolution.rules.FieldNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Reader;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the library: wires the catalog store to ingestion, resolution, enrichment
 * and catalog browsing.
 *
 * <pre>
 * try (WineResolver resolver = WineResolver.builder()
 *         .catalogStore(new InMemoryCatalogStore())
 *         .cacheConfig(CacheConfig.defaults())
 *         .build()) {
 *     resolver.importCsv(lwinCsv, ProgressCallback.NOOP);
 *     EnrichmentResult enriched = resolver.resolveAndEnrich(extracted);
 * }
 * </pre>
 */
public class WineResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WineResolver.class);

    private final WineResolutionService resolutionService;
    private final CatalogImportService importService;
    private final CatalogSearchService searchService;
    private final EnrichmentMerger merger;
    private final ExtractedWineParser extractionParser;
    private final CsvBulkImporter csvImporter;
    private final JsonBulkImporter jsonImporter;
    private final ResolutionCache cache;
    private final ResolutionOptions options;
    private volatile AsyncWineResolver asyncResolver;

    private WineResolver(Builder builder) {
        CatalogStore store = builder.catalogStore;
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        FieldNormalizer normalizer = new FieldNormalizer(builder.categoryRules);
        ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();

        if (builder.resolutionCache != null) {
            this.cache = builder.resolutionCache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineResolutionCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpResolutionCache();
        }

        this.searchService = new CatalogSearchService(store);
        this.merger = new EnrichmentMerger();
        this.resolutionService = new WineResolutionService(
                new CandidateGenerator(store), new WineMatchScorer(), searchService, merger,
                cache, metricsService, options);

        this.importService = new CatalogImportService(
                new IdentityResolver(store, builder.clock),
                new CatalogRowMapper(normalizer),
                builder.importOptions, metricsService);
        if (cache instanceof CatalogChangeListener listener) {
            importService.addListener(listener);
        }

        this.csvImporter = new CsvBulkImporter(importService);
        this.jsonImporter = new JsonBulkImporter(importService, objectMapper);
        this.extractionParser = new ExtractedWineParser(objectMapper, normalizer);

        log.info("WineResolver initialized: store={}, cache={}, options={}",
                store.getClass().getSimpleName(), cache.getClass().getSimpleName(), options);
    }

    // ========== Resolution API ==========

    public Optional<CanonicalWineRecord> resolve(UnresolvedWineRecord unresolved) {
        return resolutionService.resolve(unresolved);
    }

    public ResolutionResult resolveWithDetails(UnresolvedWineRecord unresolved) {
        return resolutionService.resolveWithDetails(unresolved);
    }

    public EnrichmentResult resolveAndEnrich(UnresolvedWineRecord unresolved) {
        return resolutionService.resolveAndEnrich(unresolved);
    }

    public UnresolvedWineRecord enrich(UnresolvedWineRecord unresolved, CanonicalWineRecord matched) {
        return merger.enrich(unresolved, matched);
    }

    /**
     * Parses label-extraction JSON into a record ready for resolution.
     */
    public UnresolvedWineRecord parseExtraction(String json) {
        return extractionParser.parse(json);
    }

    /**
     * Shared pool for concurrent resolutions, created on first use and closed with this resolver.
     */
    public AsyncWineResolver async() {
        AsyncWineResolver current = asyncResolver;
        if (current == null) {
            synchronized (this) {
                current = asyncResolver;
                if (current == null) {
                    current = new AsyncWineResolver(resolutionService, options);
                    asyncResolver = current;
                }
            }
        }
        return current;
    }

    // ========== Catalog API ==========

    public ImportResult importCsv(InputStream input, ProgressCallback callback) {
        return csvImporter.importCatalog(input, callback);
    }

    public ImportResult importCsv(Reader reader, ProgressCallback callback) {
        return csvImporter.importCatalog(reader, callback);
    }

    public ImportResult importJson(InputStream input, ProgressCallback callback) {
        return jsonImporter.importCatalog(input, callback);
    }

    public ImportResult importJson(Reader reader, ProgressCallback callback) {
        return jsonImporter.importCatalog(reader, callback);
    }

    public ImportResult importRows(List<Map<String, String>> rows) {
        return importService.importRows(rows);
    }

    public Optional<CanonicalWineRecord> findByLwin(String code) {
        return searchService.findByLwin(code);
    }

    public List<CanonicalWineRecord> search(CatalogSearchQuery query) {
        return searchService.search(query);
    }

    public CatalogStatistics statistics() {
        return searchService.statistics();
    }

    // ========== Accessors ==========

    public WineResolutionService getResolutionService() {
        return resolutionService;
    }

    public CatalogImportService getImportService() {
        return importService;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void close() {
        AsyncWineResolver current = asyncResolver;
        if (current != null) {
            current.close();
        }
        log.info("WineResolver closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogStore catalogStore;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private ImportOptions importOptions = ImportOptions.defaults();
        private CacheConfig cacheConfig;
        private ResolutionCache resolutionCache;
        private MetricsService metricsService;
        private List<CategoryRule> categoryRules = DefaultCategoryRules.rules();
        private ObjectMapper objectMapper;
        private Clock clock = Clock.systemUTC();

        public Builder catalogStore(CatalogStore catalogStore) {
            this.catalogStore = catalogStore;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder importOptions(ImportOptions importOptions) {
            this.importOptions = Objects.requireNonNull(importOptions, "importOptions is required");
            return this;
        }

        /**
         * Builds a Caffeine cache from the config. Ignored when {@link #resolutionCache} is set.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder categoryRules(List<CategoryRule> categoryRules) {
            this.categoryRules = Objects.requireNonNull(categoryRules, "categoryRules is required");
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public WineResolver build() {
            if (catalogStore == null) {
                throw new IllegalStateException("catalogStore is required");
            }
            return new WineResolver(this);
        }
    }
}
