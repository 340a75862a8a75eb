package com.entity.canonical.graph;

import com.entity.canonical.search.SearchBackendException;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Thread-safe {@link GraphConnection} over a pool it owns: each statement runs
 * on a connection borrowed for that statement alone.
 */
public class PooledFalkorDBConnection implements GraphConnection {

    private final GraphConnectionPool pool;
    private final String graphName;

    public PooledFalkorDBConnection(GraphConnectionPool pool, String graphName) {
        this.pool = pool;
        this.graphName = graphName;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        onBorrowed(connection -> {
            connection.execute(query, params);
            return null;
        });
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        return onBorrowed(connection -> connection.query(query, params));
    }

    /**
     * False when no connection can be borrowed or the borrowed one fails its ping.
     */
    @Override
    public boolean isConnected() {
        try {
            return onBorrowed(GraphConnection::isConnected);
        } catch (SearchBackendException e) {
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void ensureSynonymSchema() {
        onBorrowed(connection -> {
            connection.ensureSynonymSchema();
            return null;
        });
    }

    int borrowedConnections() {
        return pool.activeCount();
    }

    private <T> T onBorrowed(Function<GraphConnection, T> statement) {
        GraphConnection connection = pool.borrow();
        try {
            return statement.apply(connection);
        } finally {
            pool.release(connection);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
