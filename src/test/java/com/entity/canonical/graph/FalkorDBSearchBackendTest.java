package com.entity.canonical.graph;

import com.entity.canonical.search.BackendUnavailableException;
import com.entity.canonical.search.BulkResponse;
import com.entity.canonical.search.ClauseType;
import com.entity.canonical.search.IndexNotFoundException;
import com.entity.canonical.search.IndexSettings;
import com.entity.canonical.search.SearchBackendException;
import com.entity.canonical.search.SearchField;
import com.entity.canonical.search.SearchResponse;
import com.entity.canonical.search.SynonymDocument;
import com.entity.canonical.search.SynonymQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FalkorDBSearchBackendTest {

    private static final String INDEX = "synonym_city";
    private static final String SETTINGS_QUERY = "MATCH (m:SynonymIndex";
    private static final String CANDIDATE_QUERY = "ORDER BY d.seq";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private GraphConnection connection;

    private FalkorDBSearchBackend backend;

    @BeforeEach
    void setUp() {
        backend = new FalkorDBSearchBackend(connection, objectMapper);
    }

    private static SynonymDocument doc(String id, String cname, String... whitelist) {
        return new SynonymDocument(id, cname, List.of(whitelist), Map.of());
    }

    private Map<String, Object> sourceRow(SynonymDocument document) throws JsonProcessingException {
        return Map.of("source", objectMapper.writeValueAsString(document));
    }

    private static SynonymQuery query(String text) {
        return SynonymQuery.builder()
                .text(text)
                .clause(ClauseType.KEYWORD, SearchField.WHITELIST, 10)
                .clause(ClauseType.KEYWORD, SearchField.CNAME, 10)
                .clause(ClauseType.FULL_TEXT, SearchField.WHITELIST, 2)
                .clause(ClauseType.FULL_TEXT, SearchField.CNAME, 2)
                .clause(ClauseType.NGRAM, SearchField.CNAME, 1)
                .clause(ClauseType.NGRAM, SearchField.WHITELIST, 1)
                .build();
    }

    private void createIndex() {
        when(connection.query(contains(SETTINGS_QUERY), anyMap())).thenReturn(List.of());
        backend.createIndex(INDEX, IndexSettings.DEFAULT);
    }

    @Test
    @DisplayName("Creates the graph indexes on construction")
    void testCreatesGraphIndexes() {
        verify(connection).ensureSynonymSchema();
        assertEquals("falkordb", backend.getName());
    }

    @Nested
    @DisplayName("Index management")
    class IndexManagementTests {

        @Test
        @DisplayName("Stores the index settings as JSON on an index node")
        void testCreateIndex() {
            createIndex();

            verify(connection).execute(contains("CREATE (m:SynonymIndex"), argThat(params ->
                    INDEX.equals(params.get("name"))
                            && params.get("settings").toString().contains("\"shingleMinSize\":2")));
        }

        @Test
        @DisplayName("Refuses to create an index that already exists")
        void testCreateExisting() {
            when(connection.query(contains(SETTINGS_QUERY), anyMap()))
                    .thenReturn(List.of(Map.of("settings", "{}")));

            SearchBackendException e = assertThrows(SearchBackendException.class,
                    () -> backend.createIndex(INDEX, IndexSettings.DEFAULT));
            assertFalse(e instanceof BackendUnavailableException);
            verify(connection, never()).execute(contains("CREATE"), anyMap());
        }

        @Test
        @DisplayName("Deletes the documents of an index before its node")
        void testDeleteIndex() {
            backend.deleteIndex(INDEX);

            verify(connection).execute(contains("MATCH (d:SynonymDoc {index: $name})"), eq(Map.of("name", INDEX)));
            verify(connection).execute(contains("MATCH (m:SynonymIndex {name: $name})"), eq(Map.of("name", INDEX)));
        }

        @Test
        @DisplayName("Connection failures surface as BackendUnavailableException")
        void testConnectionFailure() {
            when(connection.query(anyString(), anyMap())).thenThrow(new IllegalStateException("Connection refused"));

            BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                    () -> backend.indexExists(INDEX));
            assertTrue(e.getMessage().contains("Connection refused"));
        }
    }

    @Nested
    @DisplayName("Bulk upsert")
    class BulkUpsertTests {

        @Test
        @DisplayName("Writes each document with its analyzed keywords, terms and grams")
        void testUpsert() {
            createIndex();

            BulkResponse response = backend.bulkUpsert(INDEX, List.of(doc("city_1", "Seattle", "SEA", "Emerald City")));

            assertEquals(1, response.successCount());
            verify(connection).execute(contains("MERGE (d:SynonymDoc"), argThat(params ->
                    "city_1".equals(params.get("docId"))
                            && "Seattle".equals(params.get("cname"))
                            && ((Collection<?>) params.get("keywords")).containsAll(List.of("seattle", "sea", "emerald city"))
                            && ((Collection<?>) params.get("terms")).contains("emerald")
                            && ((Collection<?>) params.get("grams")).contains("emer")
                            && params.get("source").toString().contains("\"cname\":\"Seattle\"")));
        }

        @Test
        @DisplayName("A document without cname fails alone")
        void testMissingCname() {
            createIndex();

            BulkResponse response = backend.bulkUpsert(INDEX, List.of(
                    doc("city_1", "Seattle"),
                    doc("city_2", " ")));

            assertEquals(1, response.successCount());
            assertEquals("city_2", response.failures().get(0).documentId());
            verify(connection, times(1)).execute(contains("MERGE (d:SynonymDoc"), anyMap());
        }

        @Test
        @DisplayName("A statement error on one document fails that document alone")
        void testStatementFailure() {
            createIndex();
            doAnswer(invocation -> {
                Map<String, Object> params = invocation.getArgument(1);
                if ("bad".equals(params.get("docId"))) {
                    throw new RuntimeException("ERR value too large");
                }
                return null;
            }).when(connection).execute(contains("MERGE"), anyMap());
            when(connection.isConnected()).thenReturn(true);

            BulkResponse response = backend.bulkUpsert(INDEX, List.of(
                    doc("city_1", "Seattle"),
                    doc("bad", "Tacoma"),
                    doc("city_2", "Portland")));

            assertEquals(2, response.successCount());
            assertEquals(1, response.failures().size());
            assertEquals("bad", response.failures().get(0).documentId());
            assertTrue(response.failures().get(0).error().contains("ERR value too large"));
            verify(connection, times(3)).execute(contains("MERGE (d:SynonymDoc"), anyMap());
        }

        @Test
        @DisplayName("Losing the connection fails the whole batch")
        void testConnectionLost() {
            createIndex();
            doThrow(new IllegalStateException("Connection reset"))
                    .when(connection).execute(contains("MERGE"), anyMap());
            when(connection.isConnected()).thenReturn(false);

            BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                    () -> backend.bulkUpsert(INDEX, List.of(doc("city_1", "Seattle"), doc("city_2", "Portland"))));
            assertTrue(e.getMessage().contains("city_1"));
            verify(connection, times(1)).execute(contains("MERGE"), anyMap());
        }

        @Test
        @DisplayName("An exhausted pool fails the whole batch without a ping")
        void testPoolExhausted() {
            createIndex();
            doThrow(new BackendUnavailableException("Timed out after 5000ms waiting for a FalkorDB connection"))
                    .when(connection).execute(contains("MERGE"), anyMap());

            assertThrows(BackendUnavailableException.class,
                    () -> backend.bulkUpsert(INDEX, List.of(doc("city_1", "Seattle"))));
            verify(connection, never()).isConnected();
        }

        @Test
        @DisplayName("Upserting into a missing index fails")
        void testMissingIndex() {
            when(connection.query(contains(SETTINGS_QUERY), anyMap())).thenReturn(List.of());

            assertThrows(IndexNotFoundException.class,
                    () -> backend.bulkUpsert(INDEX, List.of(doc("city_1", "Seattle"))));
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("Scores and groups the candidates returned by Cypher")
        void testSearch() throws JsonProcessingException {
            createIndex();
            when(connection.query(contains(CANDIDATE_QUERY), anyMap())).thenReturn(List.of(
                    sourceRow(doc("city_1", "Seattle", "SEA", "Emerald City")),
                    sourceRow(doc("city_2", "Portland", "PDX", "Rose City"))));

            SearchResponse response = backend.search(INDEX, query("seattle"));

            assertEquals(1, response.groups().size());
            assertEquals("Seattle", response.groups().get(0).cname());
            assertEquals(13.0, response.groups().get(0).topScore(), 1e-9);
            assertEquals(1, response.totalHits());
            verify(connection).query(contains(CANDIDATE_QUERY), argThat(params ->
                    "seattle".equals(params.get("keyword"))
                            && INDEX.equals(params.get("index"))
                            && ((Collection<?>) params.get("terms")).contains("seattle")));
        }

        @Test
        @DisplayName("Documents of one cname form one group")
        void testGrouping() throws JsonProcessingException {
            createIndex();
            when(connection.query(contains(CANDIDATE_QUERY), anyMap())).thenReturn(List.of(
                    sourceRow(doc("city_2", "Portland", "PDX")),
                    sourceRow(doc("city_5", "Portland", "Portland ME"))));

            SearchResponse response = backend.search(INDEX, query("portland"));

            assertEquals(1, response.groups().size());
            assertEquals(2, response.groups().get(0).hitCount());
        }

        @Test
        @DisplayName("An empty query matches nothing without touching the graph")
        void testEmptyQuery() {
            createIndex();

            assertTrue(backend.search(INDEX, query("  ")).groups().isEmpty());
            verify(connection, never()).query(contains(CANDIDATE_QUERY), anyMap());
        }

        @Test
        @DisplayName("A missing index fails with IndexNotFoundException")
        void testMissingIndex() {
            when(connection.query(contains(SETTINGS_QUERY), anyMap())).thenReturn(List.of());

            IndexNotFoundException e = assertThrows(IndexNotFoundException.class,
                    () -> backend.search(INDEX, query("seattle")));
            assertTrue(e.getMessage().contains(INDEX));
        }

        @Test
        @DisplayName("Settings of an index created elsewhere are read once from the graph")
        void testSettingsLoadedFromGraph() throws JsonProcessingException {
            String settings = objectMapper.writeValueAsString(IndexSettings.DEFAULT);
            when(connection.query(contains(SETTINGS_QUERY), anyMap()))
                    .thenReturn(List.of(Map.of("settings", settings)));
            when(connection.query(contains(CANDIDATE_QUERY), anyMap())).thenReturn(List.of());

            backend.search(INDEX, query("seattle"));
            backend.search(INDEX, query("portland"));

            verify(connection, times(1)).query(contains(SETTINGS_QUERY), anyMap());
        }

        @Test
        @DisplayName("Corrupt settings are reported as a backend error")
        void testCorruptSettings() {
            when(connection.query(contains(SETTINGS_QUERY), anyMap()))
                    .thenReturn(List.of(Map.of("settings", "not json")));

            assertThrows(SearchBackendException.class, () -> backend.search(INDEX, query("seattle")));
        }
    }

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("Reads a document back from its stored JSON")
        void testGetById() throws JsonProcessingException {
            createIndex();
            SynonymDocument stored = new SynonymDocument("city_1", "Seattle", List.of("SEA"), Map.of("state", "WA"));
            when(connection.query(contains("id: $docId"), anyMap()))
                    .thenReturn(List.of(sourceRow(stored)));

            assertEquals(stored, backend.getById(INDEX, "city_1").orElseThrow());
        }

        @Test
        @DisplayName("Counts the documents of an index")
        void testDocumentCount() {
            createIndex();
            when(connection.query(contains("count(d)"), anyMap())).thenReturn(List.of(Map.of("total", 5L)));

            assertEquals(5, backend.documentCount(INDEX));
        }

        @Test
        @DisplayName("Availability follows the connection")
        void testAvailability() {
            when(connection.isConnected()).thenReturn(true, false);

            assertTrue(backend.isAvailable());
            assertFalse(backend.isAvailable());
        }

        @Test
        @DisplayName("Closing the backend closes the connection")
        void testClose() {
            backend.close();
            verify(connection).close();
        }
    }
}
