package com.entity.canonical.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cypher statements backing {@link FalkorDBSearchBackend}.
 *
 * <p>An index is a {@code :SynonymIndex} node holding its settings as JSON. Each
 * document is a {@code :SynonymDoc} node keyed by {@code (index, id)} carrying the
 * document JSON and its pre-analyzed keywords, terms and grams.</p>
 */
public class SynonymCypherExecutor {

    private final GraphConnection connection;

    public SynonymCypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Index metadata ==========

    public Optional<String> findIndexSettings(String indexName) {
        String query = """
                MATCH (m:SynonymIndex {name: $name})
                RETURN m.settings as settings
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of("name", indexName));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Object settings = rows.get(0).get("settings");
        return Optional.of(settings != null ? settings.toString() : "");
    }

    public void createIndexNode(String indexName, String settingsJson) {
        String query = """
                CREATE (m:SynonymIndex {name: $name, settings: $settings})
                """;
        connection.execute(query, Map.of("name", indexName, "settings", settingsJson));
    }

    /**
     * Removes an index node and every document that belongs to it.
     */
    public void deleteIndex(String indexName) {
        connection.execute("""
                MATCH (d:SynonymDoc {index: $name})
                DELETE d
                """, Map.of("name", indexName));
        connection.execute("""
                MATCH (m:SynonymIndex {name: $name})
                DELETE m
                """, Map.of("name", indexName));
    }

    // ========== Documents ==========

    /**
     * Inserts or replaces a document. The insertion sequence is only set on
     * creation, so re-indexed documents keep their original position.
     */
    public void upsertDocument(String indexName, String documentId, String cname, String source,
                               long sequence, Collection<String> keywords, Collection<String> terms,
                               Collection<String> grams) {
        String query = """
                MERGE (d:SynonymDoc {index: $index, id: $docId})
                ON CREATE SET d.seq = $seq
                SET d.cname = $cname,
                    d.source = $source,
                    d.keywords = $keywords,
                    d.terms = $terms,
                    d.grams = $grams
                """;
        connection.execute(query, Map.of(
                "index", indexName,
                "docId", documentId,
                "seq", sequence,
                "cname", cname,
                "source", source,
                "keywords", List.copyOf(keywords),
                "terms", List.copyOf(terms),
                "grams", List.copyOf(grams)
        ));
    }

    /**
     * Finds documents sharing at least one keyword, term or gram with the query,
     * in insertion order.
     */
    public List<Map<String, Object>> findCandidates(String indexName, String keyword,
                                                    Collection<String> terms, Collection<String> grams) {
        String query = """
                MATCH (d:SynonymDoc)
                WHERE d.index = $index
                  AND ($keyword IN d.keywords
                       OR any(t IN d.terms WHERE t IN $terms)
                       OR any(g IN d.grams WHERE g IN $grams))
                RETURN d.source as source
                ORDER BY d.seq
                """;
        return connection.query(query, Map.of(
                "index", indexName,
                "keyword", keyword,
                "terms", List.copyOf(terms),
                "grams", List.copyOf(grams)
        ));
    }

    public Optional<String> findDocumentSource(String indexName, String documentId) {
        String query = """
                MATCH (d:SynonymDoc {index: $index, id: $docId})
                RETURN d.source as source
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of("index", indexName, "docId", documentId));
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable((String) rows.get(0).get("source"));
    }

    public long countDocuments(String indexName) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (d:SynonymDoc {index: $index})
                RETURN count(d) as total
                """, Map.of("index", indexName));
        if (rows.isEmpty() || rows.get(0).get("total") == null) {
            return 0;
        }
        return ((Number) rows.get(0).get("total")).longValue();
    }
}
