package com.entity.canonical.graph;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to the graph that stores synonym indexes.
 *
 * <p>Parameters are referenced as {@code $name} in the statement text.</p>
 */
public interface GraphConnection extends AutoCloseable {

    void execute(String query, Map<String, Object> params);

    /**
     * Runs a read statement and returns one map per record, keyed by the
     * {@code RETURN} aliases.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes on {@code :SynonymIndex} and {@code :SynonymDoc}
     * nodes. Safe to call when they already exist.
     */
    void ensureSynonymSchema();

    @Override
    void close();
}
