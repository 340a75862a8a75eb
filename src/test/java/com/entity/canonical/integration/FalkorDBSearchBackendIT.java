package com.entity.canonical.integration;

import com.entity.canonical.api.EntityResolver;
import com.entity.canonical.api.FitResult;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.core.model.ResolvedCandidate;
import com.entity.canonical.graph.FalkorDBSearchBackend;
import com.entity.canonical.mapping.InMemoryMappingSource;
import com.entity.canonical.search.BulkResponse;
import com.entity.canonical.search.IndexNotFoundException;
import com.entity.canonical.search.IndexSettings;
import com.entity.canonical.search.SynonymDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fits and queries synonym indexes stored in a live FalkorDB instance.
 */
@Tag("integration")
class FalkorDBSearchBackendIT extends AbstractFalkorDBIntegrationTest {

    private static final List<Map<String, Object>> CITIES = List.of(
            Map.of("id", "city_1", "cname", "Seattle", "whitelist", List.of("SEA", "Emerald City")),
            Map.of("id", "city_2", "cname", "Portland", "whitelist", List.of("PDX", "Rose City")),
            Map.of("id", "city_3", "cname", "New York City", "whitelist", List.of("NYC", "Big Apple")),
            Map.of("id", "city_4", "cname", "New York Mills", "whitelist", List.of("NYC")),
            Map.of("id", "city_5", "cname", "Portland", "whitelist", List.of("Portland ME")));

    private InMemoryMappingSource mappings;
    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        mappings = new InMemoryMappingSource().put("city", CITIES);
        resolver = createResolver("city", mappings, "synonym-backend");
    }

    @AfterEach
    void tearDown() {
        if (resolver != null) {
            resolver.close();
        }
    }

    @Test
    @DisplayName("Should fit the synonym index and rank fuzzy candidates")
    void testFitAndFuzzyRanking() {
        FitResult fit = resolver.fit(true);
        assertEquals(5, fit.items());

        ResolutionResult result = resolver.predict(EntityMention.of("seattle", "city"));
        List<ResolvedCandidate> candidates =
                assertInstanceOf(ResolutionResult.RankedCandidates.class, result).candidates();

        assertEquals("Seattle", candidates.get(0).cname());
        assertEquals(13.0, candidates.get(0).relevanceScore(), 1e-9);
    }

    @Test
    @DisplayName("Should group documents sharing a cname")
    void testGroupingByCname() {
        resolver.fit(true);

        ResolutionResult result = resolver.predict(EntityMention.of("portland", "city"));
        List<ResolvedCandidate> candidates =
                assertInstanceOf(ResolutionResult.RankedCandidates.class, result).candidates();

        assertEquals("Portland", candidates.get(0).cname());
        assertEquals(2, candidates.get(0).hitCount());
        assertEquals(1, candidates.stream().filter(c -> c.cname().equals("Portland")).count());
    }

    @Test
    @DisplayName("Should resolve a partial mention through n-grams")
    void testPartialMention() {
        resolver.fit(true);

        ResolutionResult result = resolver.predict(EntityMention.of("Seatt", "city"));
        List<ResolvedCandidate> candidates =
                assertInstanceOf(ResolutionResult.RankedCandidates.class, result).candidates();

        assertEquals("Seattle", candidates.get(0).cname());
    }

    @Test
    @DisplayName("A clean refit drops documents removed from the mapping")
    void testCleanRefit() {
        resolver.fit(true);
        FalkorDBSearchBackend backend = (FalkorDBSearchBackend) resolver.getLifecycle().backend();
        assertEquals(5, backend.documentCount("synonym_city"));

        mappings.put("city", CITIES.subList(0, 2));
        resolver.fit(true);

        assertEquals(2, backend.documentCount("synonym_city"));
        ResolutionResult result = resolver.predict(EntityMention.of("new york", "city"));
        List<ResolvedCandidate> candidates =
                assertInstanceOf(ResolutionResult.RankedCandidates.class, result).candidates();
        assertTrue(candidates.stream().noneMatch(c -> c.cname().startsWith("New York")));
    }

    @Test
    @DisplayName("Should store, read back and delete documents")
    void testBackendDocuments() {
        resolver.fit(true);
        FalkorDBSearchBackend backend = (FalkorDBSearchBackend) resolver.getLifecycle().backend();

        backend.createIndex("synonym_scratch", IndexSettings.DEFAULT);
        BulkResponse response = backend.bulkUpsert("synonym_scratch", List.of(
                new SynonymDocument("x_1", "Tacoma", List.of("Grit City"), Map.of("state", "WA"))));
        assertFalse(response.hasFailures());

        SynonymDocument stored = backend.getById("synonym_scratch", "x_1").orElseThrow();
        assertEquals("Tacoma", stored.cname());
        assertEquals(List.of("Grit City"), stored.whitelist());

        backend.deleteIndex("synonym_scratch");
        assertFalse(backend.indexExists("synonym_scratch"));
        assertThrows(IndexNotFoundException.class, () -> backend.getById("synonym_scratch", "x_1"));
    }
}
