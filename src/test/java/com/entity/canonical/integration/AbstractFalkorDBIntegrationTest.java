package com.entity.canonical.integration;

import com.entity.canonical.api.EntityResolver;
import com.entity.canonical.graph.FalkorDBSearchBackend;
import com.entity.canonical.graph.PoolConfig;
import com.entity.canonical.mapping.MappingSource;
import com.entity.canonical.search.SearchBackendFactory;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Base class for FalkorDB integration tests using Testcontainers.
 * Provides a shared FalkorDB container and resolvers whose synonym indexes
 * live in isolated graphs.
 */
@Tag("integration")
@Testcontainers
abstract class AbstractFalkorDBIntegrationTest {

    private static final int FALKORDB_PORT = 6379;

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(FALKORDB_PORT);

    /**
     * Pool settings pointing at the test container, with a unique graph name.
     *
     * @param graphNamePrefix prefix for the graph name (a UUID suffix is appended)
     */
    protected PoolConfig poolConfig(String graphNamePrefix) {
        return PoolConfig.builder()
                .host(falkorDB.getHost())
                .port(falkorDB.getMappedPort(FALKORDB_PORT))
                .graphName(graphNamePrefix + "-" + UUID.randomUUID().toString().substring(0, 8))
                .maxTotal(4)
                .build();
    }

    protected SearchBackendFactory backendFactory(String graphNamePrefix) {
        PoolConfig config = poolConfig(graphNamePrefix);
        return () -> FalkorDBSearchBackend.connect(config);
    }

    protected EntityResolver createResolver(String entityType, MappingSource mappings, String graphNamePrefix) {
        return EntityResolver.builder()
                .entityType(entityType)
                .mappingSource(mappings)
                .backendFactory(backendFactory(graphNamePrefix))
                .build();
    }
}
