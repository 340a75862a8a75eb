package com.entity.canonical.graph;

/**
 * Bounded set of {@link GraphConnection}s shared by the threads of one search backend.
 */
public interface GraphConnectionPool extends AutoCloseable {

    /**
     * Hands out a connection for the exclusive use of the caller until it is
     * {@link #release(GraphConnection) released}.
     *
     * @throws com.entity.canonical.search.BackendUnavailableException when the pool is
     *         closed or no connection frees up in time
     */
    GraphConnection borrow();

    void release(GraphConnection connection);

    int activeCount();

    int idleCount();

    @Override
    void close();
}
