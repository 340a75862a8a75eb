package com.entity.canonical.api;

import com.entity.canonical.cache.NoOpResolutionCache;
import com.entity.canonical.cache.ResolutionCache;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.lock.DistributedLock;
import com.entity.canonical.lock.LocalDistributedLock;
import com.entity.canonical.mapping.MappingSource;
import com.entity.canonical.metrics.MetricsService;
import com.entity.canonical.metrics.NoOpMetricsService;
import com.entity.canonical.rules.DefaultNormalizationRules;
import com.entity.canonical.rules.Normalizer;
import com.entity.canonical.search.SearchBackendFactory;
import com.entity.canonical.tracing.NoOpTracingService;
import com.entity.canonical.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates one {@link EntityResolver} per entity type on demand and keeps it for
 * the life of the registry. All resolvers share the normalizer, mapping source,
 * backend factory, cache, lock and observability services; each owns its own
 * backend connection.
 */
public class EntityResolverRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityResolverRegistry.class);

    private final MappingSource mappingSource;
    private final SearchBackendFactory backendFactory;
    private final Normalizer normalizer;
    private final ResolverOptions options;
    private final ResolutionCache cache;
    private final DistributedLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ConcurrentHashMap<String, EntityResolver> resolvers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private EntityResolverRegistry(Builder builder) {
        this.mappingSource = builder.mappingSource;
        this.backendFactory = builder.backendFactory;
        this.normalizer = builder.normalizer != null
                ? builder.normalizer : DefaultNormalizationRules.createDefaultEngine();
        this.options = builder.options;
        this.cache = builder.cache != null ? builder.cache : new NoOpResolutionCache();
        this.lock = builder.lock != null ? builder.lock : new LocalDistributedLock();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
    }

    /**
     * Returns the resolver of an entity type, creating it on first request.
     * Only system types and types the mapping source lists get a resolver.
     *
     * @throws IllegalArgumentException if the type is neither
     */
    public EntityResolver get(String entityType) {
        if (closed) {
            throw new IllegalStateException("Registry is closed");
        }
        EntityResolver existing = resolvers.get(entityType);
        if (existing != null) {
            return existing;
        }
        if (!EntityMention.isSystemEntity(entityType) && !mappingSource.entityTypes().contains(entityType)) {
            log.debug("registry.rejected type={} known={}", entityType, mappingSource.entityTypes());
            throw new IllegalArgumentException("Unknown entity type '" + entityType + "'");
        }
        return resolvers.computeIfAbsent(entityType, type -> EntityResolver.builder()
                .entityType(type)
                .mappingSource(mappingSource)
                .backendFactory(backendFactory)
                .normalizer(normalizer)
                .options(options)
                .cache(cache)
                .distributedLock(lock)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build());
    }

    /**
     * Fits every entity type known to the mapping source, in name order. Stops at
     * the first failure.
     */
    public Map<String, FitResult> fitAll(boolean clean) {
        Map<String, FitResult> results = new LinkedHashMap<>();
        for (String entityType : mappingSource.entityTypes()) {
            results.put(entityType, get(entityType).fit(clean));
        }
        log.info("registry.fitAll completed types={} clean={}", results.keySet(), clean);
        return results;
    }

    public Set<String> entityTypes() {
        return mappingSource.entityTypes();
    }

    /**
     * Resolvers created so far.
     */
    public Collection<EntityResolver> getResolvers() {
        return List.copyOf(resolvers.values());
    }

    public ResolverOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        closed = true;
        for (EntityResolver resolver : resolvers.values()) {
            try {
                resolver.close();
            } catch (RuntimeException e) {
                log.warn("Error closing resolver for {}: {}", resolver.getEntityType(), e.getMessage());
            }
        }
        resolvers.clear();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MappingSource mappingSource;
        private SearchBackendFactory backendFactory;
        private Normalizer normalizer;
        private ResolverOptions options = ResolverOptions.defaults();
        private ResolutionCache cache;
        private DistributedLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder mappingSource(MappingSource mappingSource) {
            this.mappingSource = mappingSource;
            return this;
        }

        public Builder backendFactory(SearchBackendFactory backendFactory) {
            this.backendFactory = backendFactory;
            return this;
        }

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

        public EntityResolverRegistry build() {
            Objects.requireNonNull(mappingSource, "mappingSource is required");
            Objects.requireNonNull(backendFactory, "backendFactory is required");
            Objects.requireNonNull(options, "options is required");
            return new EntityResolverRegistry(this);
        }
    }
}
