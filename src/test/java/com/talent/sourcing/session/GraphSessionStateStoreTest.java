package com.talent.sourcing.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.MutableClock;
import com.talent.sourcing.cache.CacheUnavailableException;
import com.talent.sourcing.graph.StubGraphConnection;
import com.talent.sourcing.lock.LocalDistributedLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphSessionStateStore using a stub GraphConnection.
 */
class GraphSessionStateStoreTest {

    private static final long T0 = Instant.parse("2025-05-01T09:00:00Z").toEpochMilli();

    private StubGraphConnection connection;
    private LocalDistributedLock lock;
    private GraphSessionStateStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        lock = new LocalDistributedLock();
        store = new GraphSessionStateStore(connection, new ObjectMapper(), lock,
                MutableClock.startingAt("2025-05-01T10:00:00Z"), 1000);
    }

    private static Map<String, Object> row(String candidateIds, int offset) {
        Map<String, Object> row = new HashMap<>();
        row.put("sessionId", "search_1");
        row.put("stage", "COLLECTION");
        row.put("discoveredEntities",
                "[{\"queryName\":\"Acme\",\"website\":null,\"canonicalId\":\"org-1\",\"matchedName\":\"Acme\","
                        + "\"confidence\":1.0,\"tier\":\"EXACT_KEY\",\"method\":\"WEBSITE_LOOKUP\"}]");
        row.put("candidateIds", candidateIds);
        row.put("paginationOffset", offset);
        row.put("stageMetadata", "{\"preview\":{\"idsFound\":3}}");
        row.put("active", true);
        row.put("createdAt", T0);
        row.put("updatedAt", T0);
        row.put("lastAccessedAt", T0);
        return row;
    }

    @Test
    void create_savesInitialStateWhenAbsent() {
        SessionState state = store.create("search_1");

        assertEquals(PipelineStage.DISCOVERY, state.stage());
        assertTrue(connection.executedQueries.stream()
                .anyMatch(q -> q.contains("MERGE (s:SearchSession {sessionId: $sessionId})")));
        Map<String, Object> saved = connection.executedParams.get(connection.executedParams.size() - 1);
        assertEquals("DISCOVERY", saved.get("stage"));
        assertEquals("[]", saved.get("candidateIds"));
        assertEquals(0, saved.get("paginationOffset"));
    }

    @Test
    void read_mapsStoredRow() {
        connection.queryResults = List.of(row("[\"c1\",\"c2\",\"c3\"]", 2));

        SessionState state = store.read("search_1");

        assertEquals(PipelineStage.COLLECTION, state.stage());
        assertEquals(List.of("c1", "c2", "c3"), state.candidateIds());
        assertEquals(2, state.paginationOffset());
        assertEquals("org-1", state.discoveredEntities().get(0).canonicalId());
        assertEquals(Map.of("idsFound", 3), state.stageMetadata().get("preview"));
        assertEquals(Instant.parse("2025-05-01T10:00:00Z"), state.lastAccessedAt());
    }

    @Test
    void read_offsetBeyondCandidatesIsCorruption() {
        connection.queryResults = List.of(row("[\"c1\"]", 5));

        SessionStateCorruptionException e = assertThrows(SessionStateCorruptionException.class,
                () -> store.read("search_1"));
        assertTrue(e.getMessage().contains("exceeds candidate count"));
    }

    @Test
    void read_unparseableRowIsCorruption() {
        connection.queryResults = List.of(row("not-json", 0));

        assertThrows(SessionStateCorruptionException.class, () -> store.read("search_1"));
    }

    @Test
    void read_missingSessionIsNotFound() {
        assertThrows(SessionNotFoundException.class, () -> store.read("search_404"));
    }

    @Test
    void graphFailure_isCacheUnavailable() {
        connection.failure = new IllegalStateException("connection reset");

        assertThrows(CacheUnavailableException.class, () -> store.read("search_1"));
    }

    @Test
    void purge_returnsDeletedCount() {
        connection.queryResults = List.of(Map.of("sessionId", "search_1"), Map.of("sessionId", "search_2"));

        assertEquals(2, store.purgeInactiveBefore(Instant.ofEpochMilli(T0)));
        assertEquals(T0, connection.executedParams.get(0).get("cutoff"));
    }

    @Test
    void purge_dropsLocksOfDeletedSessions() {
        store.create("search_1");
        store.create("search_2");
        assertEquals(2, lock.trackedKeys());

        connection.queryResults = List.of(Map.of("sessionId", "search_1"), Map.of("sessionId", "search_2"));
        store.purgeInactiveBefore(Instant.ofEpochMilli(T0));

        assertEquals(0, lock.trackedKeys());
    }
}
