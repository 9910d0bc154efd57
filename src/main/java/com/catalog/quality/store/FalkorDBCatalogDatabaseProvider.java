package com.catalog.quality.store;

import com.catalog.quality.core.model.TargetDatabase;
import com.catalog.quality.error.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Opens each target database as its own FalkorDB graph, named after its file path.
 * Connections are reused until {@link #close()}.
 */
public class FalkorDBCatalogDatabaseProvider implements CatalogDatabaseProvider, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBCatalogDatabaseProvider.class);

    private final Function<String, GraphConnection> connector;
    private final ObjectMapper mapper;
    private final Map<String, GraphConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, GraphCatalogDatabase> databases = new ConcurrentHashMap<>();

    public FalkorDBCatalogDatabaseProvider(String host, int port, ObjectMapper mapper) {
        this(graphName -> new FalkorDBConnection(host, port, graphName), mapper);
    }

    public FalkorDBCatalogDatabaseProvider(Function<String, GraphConnection> connector, ObjectMapper mapper) {
        this.connector = connector;
        this.mapper = mapper;
    }

    @Override
    public CatalogDatabase open(TargetDatabase target) {
        String path = target.filePath();
        try {
            return databases.computeIfAbsent(path, p -> {
                GraphConnection connection = connections.computeIfAbsent(graphName(p), connector);
                if (!connection.isConnected()) {
                    throw new UpstreamException(p, "Graph not reachable for " + p);
                }
                connection.createIndexes();
                return new GraphCatalogDatabase(p, connection, mapper);
            });
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException(path, "Cannot open " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Graph name for a file path: non-alphanumerics become underscores.
     */
    static String graphName(String path) {
        return "catalog_" + path.replaceAll("[^A-Za-z0-9]", "_");
    }

    @Override
    public void close() {
        connections.values().forEach(GraphConnection::close);
        connections.clear();
        databases.clear();
        log.info("graph.provider.closed");
    }
}
