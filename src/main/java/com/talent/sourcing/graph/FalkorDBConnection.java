package com.talent.sourcing.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB implementation using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEX_STATEMENTS = List.of(
            "CREATE INDEX FOR (c:CacheEntry) ON (c.key)",
            "CREATE INDEX FOR (c:CacheEntry) ON (c.fetchedAt)",
            "CREATE INDEX FOR (s:SearchSession) ON (s.sessionId)",
            "CREATE INDEX FOR (s:SearchSession) ON (s.active)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.trace("graph.execute query={}", query);
        graph.query(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.trace("graph.query query={}", query);
        ResultSet resultSet = graph.query(query, params);
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
        } catch (Exception e) {
            log.warn("graph.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        for (String statement : INDEX_STATEMENTS) {
            try {
                graph.query(statement);
            } catch (Exception e) {
                // index already exists
                log.debug("graph.index.skipped statement={} reason={}", statement, e.getMessage());
            }
        }
        log.info("graph.indexes.ready graph={}", graphName);
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.close.failed graph={}", graphName, e);
        }
        log.info("graph.closed graph={}", graphName);
    }
}
