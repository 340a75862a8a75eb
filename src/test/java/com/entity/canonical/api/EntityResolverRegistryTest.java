package com.entity.canonical.api;

import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.mapping.InMemoryMappingSource;
import com.entity.canonical.search.InMemorySearchBackend;
import com.entity.canonical.search.SearchBackendFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EntityResolverRegistryTest {

    private final AtomicInteger backendsCreated = new AtomicInteger();
    private EntityResolverRegistry registry;

    @BeforeEach
    void setUp() {
        InMemoryMappingSource mappings = new InMemoryMappingSource()
                .put("city", List.of(
                        Map.of("id", "city_1", "cname", "Seattle", "whitelist", List.of("SEA")),
                        Map.of("id", "city_2", "cname", "Portland", "whitelist", List.of("PDX"))))
                .put("airline", List.of(
                        Map.of("cname", "Alaska Airlines", "whitelist", List.of("AS", "Alaska Air")),
                        Map.of("cname", "Delta Air Lines", "whitelist", List.of("DL", "Delta"))));
        SearchBackendFactory factory = () -> {
            backendsCreated.incrementAndGet();
            return new InMemorySearchBackend();
        };
        registry = EntityResolverRegistry.builder()
                .mappingSource(mappings)
                .backendFactory(factory)
                .options(ResolverOptions.builder().topK(5).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("Returns the same resolver for repeated requests of a type")
    void testGetCachesResolver() {
        EntityResolver first = registry.get("city");

        assertSame(first, registry.get("city"));
        assertNotSame(first, registry.get("airline"));
        assertEquals(2, registry.getResolvers().size());
        assertEquals(5, first.getOptions().getTopK());
    }

    @Test
    @DisplayName("fitAll fits every type of the mapping source in name order")
    void testFitAll() {
        Map<String, FitResult> results = registry.fitAll(true);

        assertEquals(List.of("airline", "city"), List.copyOf(results.keySet()));
        assertEquals(2, results.get("airline").items());
        assertEquals(2, results.get("city").items());
        assertTrue(registry.get("city").isFitted());
        assertEquals(2, backendsCreated.get());

        ResolutionResult result = registry.get("airline").predict(EntityMention.of("Delta", "airline"), true);
        assertEquals(List.of(Map.of("cname", "Delta Air Lines")),
                assertInstanceOf(ResolutionResult.ExactMatches.class, result).items());
    }

    @Test
    @DisplayName("Unknown entity types get no resolver and open no backend")
    void testUnknownTypesRejected() {
        for (int i = 0; i < 50; i++) {
            String type = "junk" + i;
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.get(type));
            assertTrue(e.getMessage().contains(type));
        }

        assertTrue(registry.getResolvers().isEmpty());
        assertEquals(0, backendsCreated.get());
    }

    @Test
    @DisplayName("System entity types are served without a mapping")
    void testSystemTypeAccepted() {
        EntityResolver time = registry.get("sys_time");

        assertSame(time, registry.get("sys_time"));
        assertEquals(0, time.fit(true).items());
        assertEquals(0, backendsCreated.get());
    }

    @Test
    @DisplayName("Lists the entity types known to the mapping source")
    void testEntityTypes() {
        assertEquals(Set.of("airline", "city"), registry.entityTypes());
    }

    @Test
    @DisplayName("A closed registry closes its resolvers and refuses new requests")
    void testClose() {
        EntityResolver city = registry.get("city");
        city.fit(true);

        registry.close();

        assertTrue(registry.getResolvers().isEmpty());
        assertFalse(city.getLifecycle().isConnected());
        assertThrows(IllegalStateException.class, () -> registry.get("city"));
    }

    @Test
    @DisplayName("Builder requires a mapping source and a backend factory")
    void testBuilderValidation() {
        assertThrows(NullPointerException.class,
                () -> EntityResolverRegistry.builder().backendFactory(InMemorySearchBackend::new).build());
        assertThrows(NullPointerException.class,
                () -> EntityResolverRegistry.builder().mappingSource(new InMemoryMappingSource()).build());
    }
}
