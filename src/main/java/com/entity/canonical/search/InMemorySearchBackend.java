package com.entity.canonical.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Embedded {@link SearchBackend} keeping every index in process memory.
 *
 * <p>Documents keep their first insertion position when upserted again, which
 * defines the native order used to break score ties. Suitable for tests and
 * single-process deployments with small knowledge bases.</p>
 */
public class InMemorySearchBackend implements SearchBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemorySearchBackend.class);

    private final ConcurrentHashMap<String, MemoryIndex> indices = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public boolean indexExists(String indexName) {
        checkOpen();
        return indices.containsKey(indexName);
    }

    @Override
    public void createIndex(String indexName, IndexSettings settings) {
        checkOpen();
        MemoryIndex created = new MemoryIndex(settings);
        if (indices.putIfAbsent(indexName, created) != null) {
            throw new SearchBackendException("Index '" + indexName + "' already exists");
        }
        log.info("index.created name={}", indexName);
    }

    @Override
    public void deleteIndex(String indexName) {
        checkOpen();
        if (indices.remove(indexName) != null) {
            log.info("index.deleted name={}", indexName);
        }
    }

    @Override
    public BulkResponse bulkUpsert(String indexName, List<SynonymDocument> documents) {
        checkOpen();
        MemoryIndex index = require(indexName);
        List<BulkResponse.ItemResult> results = new ArrayList<>(documents.size());

        index.lock.writeLock().lock();
        try {
            for (SynonymDocument document : documents) {
                if (document.cname() == null || document.cname().isBlank()) {
                    results.add(BulkResponse.ItemResult.failed(document.id(), "cname is required"));
                    continue;
                }
                index.documents.put(document.id(), AnalyzedDocument.of(document, index.analyzer));
                results.add(BulkResponse.ItemResult.ok(document.id()));
            }
        } finally {
            index.lock.writeLock().unlock();
        }
        return new BulkResponse(results);
    }

    @Override
    public SearchResponse search(String indexName, SynonymQuery query) {
        checkOpen();
        long start = System.nanoTime();
        MemoryIndex index = require(indexName);
        ClauseScorer.PreparedQuery prepared = index.scorer.prepare(query);

        List<ScoredHit> hits = new ArrayList<>();
        index.lock.readLock().lock();
        try {
            for (AnalyzedDocument document : index.documents.values()) {
                double score = index.scorer.score(prepared, document);
                if (score > 0.0) {
                    hits.add(new ScoredHit(document.document(), score));
                }
            }
        } finally {
            index.lock.readLock().unlock();
        }

        List<CandidateGroup> groups = HitGrouper.group(hits, query.getSampleSize(), query.getMaxGroups());
        long tookMillis = (System.nanoTime() - start) / 1_000_000;
        log.debug("search.completed index={} hits={} groups={} tookMs={}",
                indexName, hits.size(), groups.size(), tookMillis);
        return new SearchResponse(groups, hits.size(), tookMillis);
    }

    @Override
    public Optional<SynonymDocument> getById(String indexName, String documentId) {
        checkOpen();
        MemoryIndex index = require(indexName);
        index.lock.readLock().lock();
        try {
            AnalyzedDocument document = index.documents.get(documentId);
            return Optional.ofNullable(document).map(AnalyzedDocument::document);
        } finally {
            index.lock.readLock().unlock();
        }
    }

    /**
     * Number of documents in an index, for diagnostics.
     */
    public int documentCount(String indexName) {
        MemoryIndex index = require(indexName);
        index.lock.readLock().lock();
        try {
            return index.documents.size();
        } finally {
            index.lock.readLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            indices.clear();
            log.info("In-memory search backend closed");
        }
    }

    private MemoryIndex require(String indexName) {
        MemoryIndex index = indices.get(indexName);
        if (index == null) {
            throw new IndexNotFoundException(indexName);
        }
        return index;
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new BackendUnavailableException("In-memory search backend is closed");
        }
    }

    private static final class MemoryIndex {
        private final TextAnalyzer analyzer;
        private final ClauseScorer scorer;
        private final Map<String, AnalyzedDocument> documents = new LinkedHashMap<>();
        private final ReadWriteLock lock = new ReentrantReadWriteLock();

        private MemoryIndex(IndexSettings settings) {
            this.analyzer = new TextAnalyzer(settings);
            this.scorer = new ClauseScorer(analyzer);
        }
    }
}
