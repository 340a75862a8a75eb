package com.entity.canonical.lifecycle;

import com.entity.canonical.search.BackendUnavailableException;
import com.entity.canonical.search.IndexSettings;
import com.entity.canonical.search.SearchBackend;
import com.entity.canonical.search.SearchBackendException;
import com.entity.canonical.search.SearchBackendFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Owns the search backend handle of one resolver and the life of its indexes.
 *
 * <p>The backend is created on first use through the factory, then reused until
 * {@link #close()}. Every index is created with {@link IndexSettings#DEFAULT}.</p>
 */
public class IndexLifecycleManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IndexLifecycleManager.class);

    public static final String DEFAULT_INDEX_PREFIX = "synonym";

    private final SearchBackendFactory backendFactory;
    private final String indexPrefix;
    private final Object connectLock = new Object();
    private volatile SearchBackend backend;
    private volatile boolean closed;

    public IndexLifecycleManager(SearchBackendFactory backendFactory) {
        this(backendFactory, DEFAULT_INDEX_PREFIX);
    }

    public IndexLifecycleManager(SearchBackendFactory backendFactory, String indexPrefix) {
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory is required");
        if (indexPrefix == null || indexPrefix.isBlank()) {
            throw new IllegalArgumentException("indexPrefix is required");
        }
        this.indexPrefix = indexPrefix;
    }

    /**
     * Returns {@code <prefix>_<entityType>}, e.g. {@code synonym_city}.
     */
    public String indexName(String entityType) {
        return indexPrefix + "_" + entityType;
    }

    /**
     * Returns the backend, connecting on the first call.
     *
     * @throws BackendUnavailableException if the manager is closed or the backend cannot be created
     */
    public SearchBackend backend() {
        SearchBackend current = backend;
        if (current != null) {
            return current;
        }
        synchronized (connectLock) {
            if (closed) {
                throw new BackendUnavailableException("Index lifecycle manager is closed");
            }
            if (backend == null) {
                try {
                    backend = Objects.requireNonNull(backendFactory.create(), "backend factory returned null");
                } catch (SearchBackendException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new BackendUnavailableException("Cannot connect to search backend: " + e.getMessage(), e);
                }
                log.info("backend.connected name={}", backend.getName());
            }
            return backend;
        }
    }

    /**
     * Whether the backend has been created and not yet closed.
     */
    public boolean isConnected() {
        return backend != null;
    }

    /**
     * Creates the entity type's index unless it already exists.
     */
    public void ensureIndex(String entityType) {
        String name = indexName(entityType);
        SearchBackend current = backend();
        if (current.indexExists(name)) {
            log.debug("index.exists name={}", name);
            return;
        }
        current.createIndex(name, IndexSettings.DEFAULT);
    }

    /**
     * Prepares the index for a reindex. A clean rebuild deletes the index first;
     * otherwise documents already in the index are kept, including those whose
     * records have since been removed from the mapping.
     */
    public void rebuild(String entityType, boolean clean) {
        if (clean) {
            String name = indexName(entityType);
            backend().deleteIndex(name);
            log.info("index.rebuild.clean name={}", name);
        }
        ensureIndex(entityType);
    }

    @Override
    public void close() {
        synchronized (connectLock) {
            closed = true;
            if (backend != null) {
                try {
                    backend.close();
                } catch (RuntimeException e) {
                    log.warn("backend.close.failed name={} error={}", backend.getName(), e.getMessage());
                }
                backend = null;
            }
        }
    }
}
