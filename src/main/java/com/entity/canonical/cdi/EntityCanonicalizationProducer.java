package com.entity.canonical.cdi;

import com.entity.canonical.api.EntityResolverRegistry;
import com.entity.canonical.api.ResolverOptions;
import com.entity.canonical.cache.CacheConfig;
import com.entity.canonical.cache.CaffeineResolutionCache;
import com.entity.canonical.cache.NoOpResolutionCache;
import com.entity.canonical.cache.ResolutionCache;
import com.entity.canonical.graph.FalkorDBSearchBackend;
import com.entity.canonical.graph.PoolConfig;
import com.entity.canonical.health.HealthCheckRegistry;
import com.entity.canonical.health.SearchBackendHealthCheck;
import com.entity.canonical.lock.LocalDistributedLock;
import com.entity.canonical.lock.LockConfig;
import com.entity.canonical.mapping.JsonMappingSource;
import com.entity.canonical.search.InMemorySearchBackend;
import com.entity.canonical.search.SearchBackendFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires the canonicalization library from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it reads configuration from {@code application.yaml} and produces the
 * {@link EntityResolverRegistry} and the {@link HealthCheckRegistry} used by the
 * REST resource.</p>
 *
 * <h2>Example configuration</h2>
 * <pre>
 * entity-canonicalization:
 *   mapping-root: /etc/kb/entities
 *   backend:
 *     type: falkordb
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: synonyms
 * </pre>
 *
 * <p>With {@code backend.type=memory} every resolver keeps its synonym index in
 * process and the FalkorDB settings are ignored.</p>
 */
@ApplicationScoped
public class EntityCanonicalizationProducer {

    private static final Logger log = LoggerFactory.getLogger(EntityCanonicalizationProducer.class);

    static final String BACKEND_MEMORY = "memory";
    static final String BACKEND_FALKORDB = "falkordb";

    // ── Mappings ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.mapping-root", defaultValue = "entities")
    String mappingRoot;

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.backend.type", defaultValue = BACKEND_FALKORDB)
    String backendType;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.falkordb.graph-name", defaultValue = "synonyms")
    String falkordbGraphName;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.pool.max-total", defaultValue = "8")
    int poolMaxTotal;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.pool.max-idle", defaultValue = "4")
    int poolMaxIdle;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.pool.min-idle", defaultValue = "0")
    int poolMinIdle;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.pool.max-wait-millis", defaultValue = "5000")
    long poolMaxWaitMillis;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.pool.test-on-borrow", defaultValue = "true")
    boolean poolTestOnBorrow;

    // ── Resolver ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.top-k", defaultValue = "10")
    int topK;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.sample-size", defaultValue = "20")
    int sampleSize;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.max-groups", defaultValue = "100")
    int maxGroups;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.batch-size", defaultValue = "50")
    int batchSize;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.max-in-flight-batches", defaultValue = "2")
    int maxInFlightBatches;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.resolver.index-prefix", defaultValue = "synonym")
    String indexPrefix;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "entity-canonicalization.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ── Fit lock ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-canonicalization.lock.timeout-ms", defaultValue = "30000")
    long lockTimeoutMs;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public EntityResolverRegistry entityResolverRegistry() {
        log.info("Producing EntityResolverRegistry: backend={} mappingRoot={}", backendType, mappingRoot);

        ResolverOptions options = ResolverOptions.builder()
                .topK(topK)
                .sampleSize(sampleSize)
                .maxGroups(maxGroups)
                .batchSize(batchSize)
                .maxInFlightBatches(maxInFlightBatches)
                .indexPrefix(indexPrefix)
                .build();

        return EntityResolverRegistry.builder()
                .mappingSource(new JsonMappingSource(Path.of(mappingRoot)))
                .backendFactory(backendFactory())
                .options(options)
                .cache(createCache())
                .distributedLock(new LocalDistributedLock(LockConfig.withTimeout(lockTimeoutMs)))
                .build();
    }

    public void closeRegistry(@Disposes EntityResolverRegistry registry) {
        log.info("Closing EntityResolverRegistry");
        registry.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(EntityResolverRegistry registry) {
        HealthCheckRegistry healthChecks = new HealthCheckRegistry();
        healthChecks.register(new SearchBackendHealthCheck(registry));
        return healthChecks;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    SearchBackendFactory backendFactory() {
        if (BACKEND_MEMORY.equalsIgnoreCase(backendType)) {
            return InMemorySearchBackend::new;
        }
        if (!BACKEND_FALKORDB.equalsIgnoreCase(backendType)) {
            throw new IllegalStateException("Unknown backend type '" + backendType
                    + "', expected '" + BACKEND_MEMORY + "' or '" + BACKEND_FALKORDB + "'");
        }
        PoolConfig poolConfig = PoolConfig.builder()
                .host(falkordbHost)
                .port(falkordbPort)
                .graphName(falkordbGraphName)
                .maxTotal(poolMaxTotal)
                .maxIdle(poolMaxIdle)
                .minIdle(poolMinIdle)
                .maxWait(Duration.ofMillis(poolMaxWaitMillis))
                .validateOnBorrow(poolTestOnBorrow)
                .build();
        log.info("FalkorDB backend: {}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return () -> FalkorDBSearchBackend.connect(poolConfig);
    }

    private ResolutionCache createCache() {
        if (!cacheEnabled) {
            log.info("Fuzzy result cache disabled");
            return new NoOpResolutionCache();
        }
        return new CaffeineResolutionCache(new CacheConfig(cacheMaxSize, Duration.ofSeconds(cacheTtlSeconds)));
    }
}
