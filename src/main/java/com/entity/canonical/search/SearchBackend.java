package com.entity.canonical.search;

import java.util.List;
import java.util.Optional;

/**
 * Ranked full-text search backend holding synonym documents.
 *
 * <p>Implementations must be safe for concurrent reads. Every operation on a
 * missing index other than {@link #indexExists}, {@link #createIndex} and
 * {@link #deleteIndex} fails with {@link IndexNotFoundException}; connectivity
 * problems fail with {@link BackendUnavailableException}.</p>
 */
public interface SearchBackend extends AutoCloseable {

    /**
     * Returns a short name identifying the implementation, for logs and health checks.
     */
    String getName();

    boolean indexExists(String indexName);

    /**
     * Creates an index with the given analysis settings.
     *
     * @throws SearchBackendException if the index already exists
     */
    void createIndex(String indexName, IndexSettings settings);

    /**
     * Deletes an index and all its documents. Deleting a missing index is a no-op.
     */
    void deleteIndex(String indexName);

    /**
     * Inserts or replaces documents by id.
     */
    BulkResponse bulkUpsert(String indexName, List<SynonymDocument> documents);

    SearchResponse search(String indexName, SynonymQuery query);

    Optional<SynonymDocument> getById(String indexName, String documentId);

    /**
     * Checks connectivity without throwing.
     */
    boolean isAvailable();

    @Override
    void close();
}
