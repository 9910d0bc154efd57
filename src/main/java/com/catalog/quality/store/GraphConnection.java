package com.catalog.quality.store;

import java.util.List;
import java.util.Map;

/**
 * Cypher access to one graph. Each project database lives in its own graph.
 */
public interface GraphConnection extends AutoCloseable {

    void execute(String query, Map<String, Object> params);

    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the record and raw item indexes if missing.
     */
    void createIndexes();

    @Override
    void close();
}
