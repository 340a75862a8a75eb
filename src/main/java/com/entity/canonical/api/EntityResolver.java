package com.entity.canonical.api;

import com.entity.canonical.bulk.BulkIndexer;
import com.entity.canonical.bulk.IndexingResult;
import com.entity.canonical.bulk.ProgressCallback;
import com.entity.canonical.cache.NoOpResolutionCache;
import com.entity.canonical.cache.ResolutionCache;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.engine.ExactMatchResolver;
import com.entity.canonical.engine.FuzzyMatchResolver;
import com.entity.canonical.index.SynonymIndex;
import com.entity.canonical.index.SynonymIndexBuilder;
import com.entity.canonical.lifecycle.IndexLifecycleManager;
import com.entity.canonical.lock.DistributedLock;
import com.entity.canonical.lock.LocalDistributedLock;
import com.entity.canonical.lock.LockAcquisitionException;
import com.entity.canonical.logging.LogContext;
import com.entity.canonical.mapping.MappingSource;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.metrics.NoOpMetricsService;
import com.entity.canonical.rules.DefaultNormalizationRules;
import com.entity.canonical.rules.Normalizer;
import com.entity.canonical.search.SearchBackendFactory;
import com.entity.canonical.search.SynonymDocument;
import com.entity.canonical.tracing.NoOpTracingService;
import com.entity.canonical.tracing.Span;
import com.entity.canonical.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves mentions of one entity type to canonical knowledge-base records.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * EntityResolver resolver = EntityResolver.builder()
 *     .entityType("city")
 *     .mappingSource(new JsonMappingSource(Path.of("entities")))
 *     .backendFactory(InMemorySearchBackend::new)
 *     .build();
 *
 * resolver.fit(true);
 * ResolutionResult exact = resolver.predict(EntityMention.of("SEA", "city"), true);
 * ResolutionResult ranked = resolver.predict(EntityMention.of("seatle", "city"));
 * </pre>
 *
 * <p>Reads never block: {@link #predict} uses the synonym index published by the
 * last completed fit. A fit builds the new index off to the side and swaps it in
 * once the backend has been populated. Fits of the same entity type are
 * serialized through the {@link DistributedLock}; a second caller waits up to
 * the lock timeout and then fails.</p>
 *
 * <p>A non-clean fit upserts into the existing backend index and never deletes
 * documents, so records removed from the mapping stay searchable on the fuzzy
 * path until the next {@code fit(true)}.</p>
 */
public class EntityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final String entityType;
    private final boolean systemEntity;
    private final MappingSource mappingSource;
    private final ResolverOptions options;
    private final SynonymIndexBuilder indexBuilder;
    private final IndexLifecycleManager lifecycle;
    private final BulkIndexer bulkIndexer;
    private final ExactMatchResolver exactMatcher;
    private final FuzzyMatchResolver fuzzyMatcher;
    private final DistributedLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ProgressCallback progressCallback;

    private volatile SynonymIndex index;
    private volatile boolean fitted;

    private EntityResolver(Builder builder) {
        this.entityType = builder.entityType;
        this.systemEntity = EntityMention.isSystemEntity(entityType);
        this.mappingSource = builder.mappingSource;
        this.options = builder.options;
        ResolutionCache cache = builder.cache != null ? builder.cache : new NoOpResolutionCache();
        this.lock = builder.lock != null ? builder.lock : new LocalDistributedLock();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.progressCallback = builder.progressCallback != null
                ? builder.progressCallback : ProgressCallback.NOOP;

        Normalizer normalizer = builder.normalizer != null
                ? builder.normalizer : DefaultNormalizationRules.createDefaultEngine();
        this.indexBuilder = new SynonymIndexBuilder(normalizer);
        this.lifecycle = new IndexLifecycleManager(builder.backendFactory, options.getIndexPrefix());
        this.bulkIndexer = new BulkIndexer(options.getBatchSize(), options.getMaxInFlightBatches());
        this.exactMatcher = new ExactMatchResolver(normalizer, metricsService);
        this.fuzzyMatcher = new FuzzyMatchResolver(normalizer, options, cache, metricsService, tracingService);
        this.index = SynonymIndex.empty(entityType);

        log.debug("EntityResolver created: type={} options={}", entityType, options);
    }

    // ========== Lifecycle ==========

    /**
     * Equivalent to {@code fit(false)}.
     */
    public FitResult load() {
        return fit(false);
    }

    public FitResult fit() {
        return fit(false);
    }

    /**
     * Loads the mapping, rebuilds the synonym index and pushes every record to the
     * search backend. The new synonym index is published once the push returns,
     * including when it was {@link BulkIndexer#abort() aborted}: the exact path then
     * answers from the new mapping while the backend may hold only part of it, and
     * {@link FitResult#isComplete()} is false. A backend error during the push
     * leaves the previous synonym index published. Either way cached fuzzy results
     * of the type are dropped.
     *
     * @param clean delete and recreate the backend index first
     * @throws com.entity.canonical.core.DuplicateIdentifierException  if two records share an id;
     *                                                                 nothing is written
     * @throws com.entity.canonical.core.MappingLoadException          if the mapping cannot be read
     * @throws com.entity.canonical.search.SearchBackendException      if the backend fails
     * @throws com.entity.canonical.lock.LockAcquisitionException      if another fit holds the lock too long
     */
    public FitResult fit(boolean clean) {
        if (systemEntity) {
            log.debug("fit.skipped type={} reason=system-entity", entityType);
            return FitResult.skipped(entityType, clean);
        }

        String lockKey = DistributedLock.fitKey(entityType);
        if (!lock.tryLock(lockKey)) {
            throw new LockAcquisitionException(lockKey, "Fit lock refused for entity type '" + entityType + "'");
        }
        try (LogContext ctx = LogContext.fit(entityType);
             Span span = tracingService.startSpan(TracingService.FIT, Map.of(
                     "entityType", entityType,
                     "clean", String.valueOf(clean)))) {
            long start = System.nanoTime();
            try {
                List<Map<String, Object>> records = mappingSource.load(entityType);
                SynonymIndex built = indexBuilder.build(entityType, records);
                List<SynonymDocument> documents = indexBuilder.toDocuments(built);

                lifecycle.rebuild(entityType, clean);
                String indexName = lifecycle.indexName(entityType);
                log.info("fit.indexing type={} index={} documents={} clean={}",
                        entityType, indexName, documents.size(), clean);
                IndexingResult indexing = bulkIndexer.push(lifecycle.backend(), indexName, documents, progressCallback);

                this.index = built;
                this.fitted = true;
                fuzzyMatcher.invalidate(entityType);

                Duration duration = Duration.ofNanos(System.nanoTime() - start);
                metricsService.recordFitDuration(entityType, duration);
                metricsService.recordDocumentsIndexed(entityType, indexing.indexed(), indexing.failureCount());
                span.attribute("documents", documents.size())
                        .attribute("failed", indexing.failureCount())
                        .succeeded();

                FitResult result = new FitResult(entityType, clean, built.itemCount(), built.aliasCount(),
                        indexing, duration);
                if (indexing.aborted()) {
                    log.warn("fit.aborted type={} result={}", entityType, indexing);
                } else {
                    log.info("fit.completed type={} items={} aliases={} indexed={} failed={} durationMs={}",
                            entityType, result.items(), result.aliases(), indexing.indexed(),
                            indexing.failureCount(), duration.toMillis());
                }
                return result;
            } catch (RuntimeException e) {
                fuzzyMatcher.invalidate(entityType);
                span.failed(e);
                log.error("fit.failed type={} error={}", entityType, e.getMessage());
                throw e;
            }
        } finally {
            lock.unlock(lockKey);
        }
    }

    // ========== Resolution ==========

    public ResolutionResult predict(EntityMention mention) {
        return predict(mention, false, options.getTopK());
    }

    public ResolutionResult predict(EntityMention mention, boolean exactMatchOnly) {
        return predict(mention, exactMatchOnly, options.getTopK());
    }

    /**
     * Resolves a mention. System entities return their value unchanged; otherwise
     * the exact path runs when {@code exactMatchOnly} is set and the fuzzy path
     * runs when it is not.
     *
     * @param topK maximum number of fuzzy candidates, ignored on the exact path
     * @throws com.entity.canonical.search.IndexNotFoundException      fuzzy path, index missing
     * @throws com.entity.canonical.search.BackendUnavailableException fuzzy path, backend unreachable
     */
    public ResolutionResult predict(EntityMention mention, boolean exactMatchOnly, int topK) {
        Objects.requireNonNull(mention, "mention is required");
        if (!entityType.equals(mention.type())) {
            throw new IllegalArgumentException("Mention of type '" + mention.type()
                    + "' passed to resolver for '" + entityType + "'");
        }

        try (LogContext ctx = LogContext.resolve(entityType)) {
            long start = System.nanoTime();
            String path;
            ResolutionResult result;
            if (mention.isSystemEntity()) {
                path = "system";
                result = new ResolutionResult.PreResolved(mention.value());
            } else if (exactMatchOnly) {
                path = "exact";
                result = exactMatcher.resolve(mention, index);
            } else {
                path = "fuzzy";
                result = fuzzyMatcher.resolve(mention, lifecycle.backend(), lifecycle.indexName(entityType), topK);
            }

            metricsService.recordResolutionDuration(entityType, path, Duration.ofNanos(System.nanoTime() - start));
            if (result instanceof ResolutionResult.ExactMatches exact) {
                metricsService.recordCandidateCount(entityType, exact.items().size());
            } else if (result instanceof ResolutionResult.RankedCandidates ranked) {
                metricsService.recordCandidateCount(entityType, ranked.candidates().size());
            }
            return result;
        }
    }

    /**
     * Not implemented: always returns an empty list. Reserved for a statistical
     * resolver that assigns probabilities to resolved values; callers needing
     * scores should use the fuzzy path of {@link #predict}.
     */
    public List<ValueProbability> predictProba(EntityMention mention) {
        Objects.requireNonNull(mention, "mention is required");
        log.debug("predictProba.unimplemented type={}", entityType);
        return List.of();
    }

    // ========== Accessors ==========

    public String getEntityType() {
        return entityType;
    }

    public boolean isSystemEntity() {
        return systemEntity;
    }

    /**
     * Whether a fit has completed since this resolver was created.
     */
    public boolean isFitted() {
        return fitted;
    }

    /**
     * The synonym index published by the last completed fit.
     */
    public SynonymIndex getIndex() {
        return index;
    }

    public IndexLifecycleManager getLifecycle() {
        return lifecycle;
    }

    public ResolverOptions getOptions() {
        return options;
    }

    /**
     * Stops any running fit between batches, then closes the backend handle.
     */
    @Override
    public void close() {
        bulkIndexer.close();
        lifecycle.close();
        log.debug("EntityResolver closed: type={}", entityType);
    }

    /**
     * A resolved value with its probability.
     */
    public record ValueProbability(Object value, double probability) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityType;
        private MappingSource mappingSource;
        private SearchBackendFactory backendFactory;
        private Normalizer normalizer;
        private ResolverOptions options = ResolverOptions.defaults();
        private ResolutionCache cache;
        private DistributedLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ProgressCallback progressCallback;

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder mappingSource(MappingSource mappingSource) {
            this.mappingSource = mappingSource;
            return this;
        }

        /**
         * Factory for the backend connection; called once, on first use.
         */
        public Builder backendFactory(SearchBackendFactory backendFactory) {
            this.backendFactory = backendFactory;
            return this;
        }

        /**
         * Defaults to {@link DefaultNormalizationRules#createDefaultEngine()}.
         */
        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = options;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Defaults to a {@link LocalDistributedLock} private to this resolver.
         */
        public Builder distributedLock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public EntityResolver build() {
            if (entityType == null || entityType.isBlank()) {
                throw new IllegalStateException("entityType is required");
            }
            Objects.requireNonNull(mappingSource, "mappingSource is required");
            Objects.requireNonNull(backendFactory, "backendFactory is required");
            Objects.requireNonNull(options, "options is required");
            return new EntityResolver(this);
        }
    }
}
