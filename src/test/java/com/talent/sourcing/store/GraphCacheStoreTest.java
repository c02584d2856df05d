package com.talent.sourcing.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.cache.CacheEntry;
import com.talent.sourcing.cache.CacheUnavailableException;
import com.talent.sourcing.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphCacheStore using a stub GraphConnection.
 */
class GraphCacheStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private StubGraphConnection connection;
    private GraphCacheStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        store = new GraphCacheStore(connection, mapper);
    }

    @Test
    void save_mergesEntryWithSerializedPayload() {
        Instant fetched = Instant.parse("2025-01-10T08:00:00Z");
        store.save(CacheEntry.fetched("candidate:42", mapper.createObjectNode().put("name", "Ada"), fetched));

        assertTrue(connection.executedQueries.get(0).contains("MERGE (c:CacheEntry {key: $key})"));
        Map<String, Object> params = connection.executedParams.get(0);
        assertEquals("candidate:42", params.get("key"));
        assertEquals("{\"name\":\"Ada\"}", params.get("payload"));
        assertEquals(fetched.toEpochMilli(), params.get("fetchedAt"));
        assertEquals(0L, params.get("accessCount"));
    }

    @Test
    void load_mapsRowToEntry() {
        connection.queryResults = List.of(Map.of(
                "key", "org-record:7",
                "payload", "{\"name\":\"Acme\"}",
                "fetchedAt", 1_700_000_000_000L,
                "lastAccessedAt", 1_700_000_100_000L,
                "accessCount", 3));

        Optional<CacheEntry> entry = store.load("org-record:7");

        assertTrue(entry.isPresent());
        assertEquals("Acme", entry.get().payload().get("name").asText());
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), entry.get().fetchedAt());
        assertEquals(3, entry.get().accessCount());
    }

    @Test
    void load_returnsEmptyWhenNoRow() {
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    void load_unreadablePayloadIsUnavailable() {
        connection.queryResults = List.of(Map.of(
                "key", "k", "payload", "{not json", "fetchedAt", 1L, "accessCount", 0));

        assertThrows(CacheUnavailableException.class, () -> store.load("k"));
    }

    @Test
    void touch_incrementsAccessCountInCypher() {
        store.touch("candidate:1", Instant.ofEpochMilli(5000));

        String cypher = connection.executedQueries.get(0);
        assertTrue(cypher.contains("c.accessCount = coalesce(c.accessCount, 0) + 1"));
        assertEquals(5000L, connection.executedParams.get(0).get("accessedAt"));
    }

    @Test
    void deleteFetchedBefore_returnsDeletedCount() {
        connection.queryResults = List.of(Map.of("deleted", 12L));

        assertEquals(12, store.deleteFetchedBefore(Instant.ofEpochMilli(1000)));
        assertEquals(1000L, connection.executedParams.get(0).get("cutoff"));
    }

    @Test
    void connectionFailure_isWrappedAsCacheUnavailable() {
        connection.failure = new IllegalStateException("connection refused");

        CacheUnavailableException e = assertThrows(CacheUnavailableException.class,
                () -> store.load("candidate:1"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
