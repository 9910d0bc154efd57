package com.catalog.quality.store;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link GraphConnection} over the JFalkorDB driver. Parameters are inlined as escaped literals.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (r:Record) ON (r.id)",
            "CREATE INDEX FOR (r:Record) ON (r.reference)",
            "CREATE INDEX FOR (r:Record) ON (r.active)",
            "CREATE INDEX FOR (i:RawItem) ON (i.seq)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connection.opened graph={} host={} port={}", graphName, host, port);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        graph.query(inline(query, params));
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        ResultSet resultSet = graph.query(inline(query, params));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("graph.connection.check.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        for (String statement : INDEXES) {
            try {
                graph.query(statement);
            } catch (RuntimeException e) {
                // FalkorDB rejects an index that already exists
                log.debug("graph.index.skipped graph={} statement={} reason={}", graphName, statement, e.getMessage());
            }
        }
    }

    static String inline(String query, Map<String, Object> params) {
        String result = query;
        // longest names first so $id does not clobber $idList
        List<String> names = new ArrayList<>(params.keySet());
        names.sort((a, b) -> b.length() - a.length());
        for (String name : names) {
            result = result.replace("$" + name, literal(params.get(name)));
        }
        return result;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> e.getKey() + ": " + literal(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(FalkorDBConnection::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.connection.close.failed graph={} error={}", graphName, e.getMessage());
        }
        log.info("graph.connection.closed graph={}", graphName);
    }
}
