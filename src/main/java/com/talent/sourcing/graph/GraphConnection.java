package com.talent.sourcing.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database that backs the persistent cache and session stores.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher query, with {@code $name} parameter placeholders
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return result rows as column-name maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by the cache and session stores if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
