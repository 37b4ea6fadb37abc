package com.soccer.graph.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link GraphConnection} to one FalkorDB graph through the JFalkorDB driver.
 *
 * <p>Statements are sent with their parameter map, never with values spliced into the
 * text. A statement the server rejects surfaces as {@link GraphStatementException}.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this(FalkorDB.driver(host, port), graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    FalkorDBConnection(Driver driver, String graphName) {
        this.driver = Objects.requireNonNull(driver, "driver is required");
        this.graphName = Objects.requireNonNull(graphName, "graphName is required");
        this.graph = driver.graph(graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("falkordb.execute graph={} statement={} params={}", graphName, query, params.keySet());
        run(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("falkordb.query graph={} statement={} params={}", graphName, query, params.keySet());
        ResultSet resultSet = run(query, params);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : record.keys()) {
                row.put(column, fromFalkor(record.getValue(column)));
            }
            rows.add(row);
        }
        log.debug("falkordb.query.rows graph={} count={}", graphName, rows.size());
        return rows;
    }

    private ResultSet run(String query, Map<String, Object> params) {
        try {
            return graph.query(query, params);
        } catch (RuntimeException e) {
            throw new GraphStatementException(graphName, query, e);
        }
    }

    /**
     * FalkorDB returns every integer as a Long. Values that fit are narrowed back to
     * Integer, the type goal counts, seasons and ratings have in the in-memory store.
     */
    static Object fromFalkor(Object value) {
        if (value instanceof Long number && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
            return number.intValue();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(FalkorDBConnection::fromFalkor).collect(Collectors.toList());
        }
        return value;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("falkordb.unreachable graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void close() {
        try {
            driver.close();
            log.info("falkordb.closed graph={}", graphName);
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={}", graphName, e);
        }
    }
}
