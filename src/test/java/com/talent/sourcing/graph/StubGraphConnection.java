package com.talent.sourcing.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Graph connection that records statements and replays canned rows.
 * Rows queued with {@link #enqueue} are returned by successive queries; once the
 * queue is empty, {@link #queryResults} is returned.
 */
public class StubGraphConnection implements GraphConnection {

    public final List<String> executedQueries = new ArrayList<>();
    public final List<Map<String, Object>> executedParams = new ArrayList<>();
    public List<Map<String, Object>> queryResults = List.of();
    public RuntimeException failure;

    private final Deque<List<Map<String, Object>>> queued = new ArrayDeque<>();

    public void enqueue(List<Map<String, Object>> rows) {
        queued.addLast(rows);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        executedQueries.add(query);
        executedParams.add(params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        executedQueries.add(query);
        executedParams.add(params);
        return queued.isEmpty() ? queryResults : queued.pollFirst();
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public String getGraphName() {
        return "test";
    }

    @Override
    public void createIndexes() {
    }

    @Override
    public void close() {
    }
}
