package com.entity.canonical.graph;

import com.entity.canonical.search.AnalyzedDocument;
import com.entity.canonical.search.BackendUnavailableException;
import com.entity.canonical.search.BulkResponse;
import com.entity.canonical.search.CandidateGroup;
import com.entity.canonical.search.ClauseScorer;
import com.entity.canonical.search.HitGrouper;
import com.entity.canonical.search.IndexNotFoundException;
import com.entity.canonical.search.IndexSettings;
import com.entity.canonical.search.ScoredHit;
import com.entity.canonical.search.SearchBackend;
import com.entity.canonical.search.SearchBackendException;
import com.entity.canonical.search.SearchResponse;
import com.entity.canonical.search.SynonymDocument;
import com.entity.canonical.search.SynonymQuery;
import com.entity.canonical.search.TextAnalyzer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * {@link SearchBackend} storing synonym documents in a FalkorDB graph.
 *
 * <p>Documents are analyzed once at write time and their keywords, terms and
 * grams stored on the node, so candidate selection happens in Cypher. Candidates
 * are then scored and grouped in process with {@link ClauseScorer} and
 * {@link HitGrouper}, giving the same ranking as the in-memory backend.</p>
 */
public class FalkorDBSearchBackend implements SearchBackend {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBSearchBackend.class);

    private final SynonymCypherExecutor executor;
    private final ObjectMapper objectMapper;
    private final Map<String, TextAnalyzer> analyzers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(System.currentTimeMillis() * 1000);

    public FalkorDBSearchBackend(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public FalkorDBSearchBackend(GraphConnection connection, ObjectMapper objectMapper) {
        this.executor = new SynonymCypherExecutor(connection);
        this.objectMapper = objectMapper;
        call("create graph indexes", () -> {
            connection.ensureSynonymSchema();
            return null;
        });
    }

    /**
     * Connects to FalkorDB through a new connection pool owned by the backend.
     */
    public static FalkorDBSearchBackend connect(PoolConfig config) {
        GraphConnectionPool pool = new SimpleGraphConnectionPool(config);
        return new FalkorDBSearchBackend(new PooledFalkorDBConnection(pool, config.graphName()));
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public boolean indexExists(String indexName) {
        return call("index exists", () -> executor.findIndexSettings(indexName).isPresent());
    }

    @Override
    public void createIndex(String indexName, IndexSettings settings) {
        String json = toJson(settings);
        call("create index", () -> {
            if (executor.findIndexSettings(indexName).isPresent()) {
                throw new SearchBackendException("Index '" + indexName + "' already exists");
            }
            executor.createIndexNode(indexName, json);
            return null;
        });
        analyzers.put(indexName, new TextAnalyzer(settings));
        log.info("index.created name={} backend=falkordb", indexName);
    }

    @Override
    public void deleteIndex(String indexName) {
        analyzers.remove(indexName);
        call("delete index", () -> {
            executor.deleteIndex(indexName);
            return null;
        });
        log.info("index.deleted name={} backend=falkordb", indexName);
    }

    @Override
    public BulkResponse bulkUpsert(String indexName, List<SynonymDocument> documents) {
        TextAnalyzer analyzer = analyzer(indexName);
        List<BulkResponse.ItemResult> results = new ArrayList<>(documents.size());

        for (SynonymDocument document : documents) {
            if (document.cname() == null || document.cname().isBlank()) {
                results.add(BulkResponse.ItemResult.failed(document.id(), "cname is required"));
                continue;
            }
            try {
                upsert(indexName, document, analyzer);
                results.add(BulkResponse.ItemResult.ok(document.id()));
            } catch (BackendUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                // a statement error on a live connection belongs to this document only
                if (!(e instanceof SearchBackendException) && !executor.getConnection().isConnected()) {
                    throw new BackendUnavailableException("FalkorDB upsert of '" + document.id()
                            + "' failed: " + e.getMessage(), e);
                }
                log.warn("bulk.item.failed index={} id={} error={}", indexName, document.id(), e.getMessage());
                results.add(BulkResponse.ItemResult.failed(document.id(), e.getMessage()));
            }
        }
        return new BulkResponse(results);
    }

    @Override
    public SearchResponse search(String indexName, SynonymQuery query) {
        long start = System.nanoTime();
        TextAnalyzer analyzer = analyzer(indexName);
        ClauseScorer scorer = new ClauseScorer(analyzer);
        ClauseScorer.PreparedQuery prepared = scorer.prepare(query);
        TextAnalyzer.AnalyzedValue analyzed = prepared.analyzed();

        if (analyzed.keyword().isEmpty()) {
            return SearchResponse.empty();
        }

        List<Map<String, Object>> rows = call("search", () -> executor.findCandidates(
                indexName, analyzed.keyword(), analyzed.terms(), analyzed.grams()));

        List<ScoredHit> hits = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            SynonymDocument document = fromJson((String) row.get("source"));
            double score = scorer.score(prepared, AnalyzedDocument.of(document, analyzer));
            if (score > 0.0) {
                hits.add(new ScoredHit(document, score));
            }
        }

        List<CandidateGroup> groups = HitGrouper.group(hits, query.getSampleSize(), query.getMaxGroups());
        long tookMillis = (System.nanoTime() - start) / 1_000_000;
        log.debug("search.completed index={} candidates={} hits={} groups={} tookMs={}",
                indexName, rows.size(), hits.size(), groups.size(), tookMillis);
        return new SearchResponse(groups, hits.size(), tookMillis);
    }

    @Override
    public Optional<SynonymDocument> getById(String indexName, String documentId) {
        analyzer(indexName);
        return call("get document", () -> executor.findDocumentSource(indexName, documentId))
                .map(this::fromJson);
    }

    public long documentCount(String indexName) {
        analyzer(indexName);
        return call("count documents", () -> executor.countDocuments(indexName));
    }

    @Override
    public boolean isAvailable() {
        return executor.getConnection().isConnected();
    }

    @Override
    public void close() {
        analyzers.clear();
        executor.getConnection().close();
    }

    private void upsert(String indexName, SynonymDocument document, TextAnalyzer analyzer) {
        AnalyzedDocument analyzed = AnalyzedDocument.of(document, analyzer);
        Set<String> keywords = new LinkedHashSet<>();
        Set<String> terms = new LinkedHashSet<>();
        Set<String> grams = new LinkedHashSet<>();
        collect(analyzed.cname(), keywords, terms, grams);
        analyzed.whitelist().forEach(value -> collect(value, keywords, terms, grams));

        String source = toJson(document);
        executor.upsertDocument(indexName, document.id(), document.cname(), source,
                sequence.incrementAndGet(), keywords, terms, grams);
    }

    private static void collect(TextAnalyzer.AnalyzedValue value, Set<String> keywords,
                                Set<String> terms, Set<String> grams) {
        if (!value.keyword().isEmpty()) {
            keywords.add(value.keyword());
        }
        terms.addAll(value.terms());
        grams.addAll(value.grams());
    }

    /**
     * Returns the analyzer of an existing index, reading its settings from the
     * graph the first time.
     */
    private TextAnalyzer analyzer(String indexName) {
        TextAnalyzer cached = analyzers.get(indexName);
        if (cached != null) {
            return cached;
        }
        String json = call("read index settings", () -> executor.findIndexSettings(indexName))
                .orElseThrow(() -> new IndexNotFoundException(indexName));
        try {
            TextAnalyzer analyzer = new TextAnalyzer(objectMapper.readValue(json, IndexSettings.class));
            analyzers.put(indexName, analyzer);
            return analyzer;
        } catch (JsonProcessingException e) {
            throw new SearchBackendException("Corrupt settings for index '" + indexName + "'", e);
        }
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (SearchBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException("FalkorDB " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SearchBackendException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private SynonymDocument fromJson(String json) {
        try {
            return objectMapper.readValue(json, SynonymDocument.class);
        } catch (JsonProcessingException e) {
            throw new SearchBackendException("Corrupt synonym document: " + e.getOriginalMessage(), e);
        }
    }
}
