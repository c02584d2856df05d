package com.talent.sourcing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.cache.CacheEntry;
import com.talent.sourcing.cache.CacheUnavailableException;
import com.talent.sourcing.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache store persisted as {@code :CacheEntry} nodes in FalkorDB.
 * Payloads are stored as JSON strings; timestamps as epoch milliseconds.
 */
public class GraphCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(GraphCacheStore.class);

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphCacheStore(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry> load(String key) {
        String cypher = """
                MATCH (c:CacheEntry {key: $key})
                RETURN c.key as key, c.payload as payload, c.fetchedAt as fetchedAt,
                       c.lastAccessedAt as lastAccessedAt, c.accessCount as accessCount
                """;
        List<Map<String, Object>> rows = run(() -> connection.query(cypher, Map.of("key", key)), key);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToEntry(rows.get(0)));
    }

    @Override
    public void save(CacheEntry entry) {
        String cypher = """
                MERGE (c:CacheEntry {key: $key})
                SET c.payload = $payload,
                    c.fetchedAt = $fetchedAt,
                    c.lastAccessedAt = $lastAccessedAt,
                    c.accessCount = $accessCount
                """;
        Map<String, Object> params = Map.of(
                "key", entry.key(),
                "payload", writePayload(entry.payload()),
                "fetchedAt", entry.fetchedAt().toEpochMilli(),
                "lastAccessedAt", entry.lastAccessedAt().toEpochMilli(),
                "accessCount", entry.accessCount());
        run(() -> {
            connection.execute(cypher, params);
            return null;
        }, entry.key());
    }

    @Override
    public void touch(String key, Instant accessedAt) {
        String cypher = """
                MATCH (c:CacheEntry {key: $key})
                SET c.lastAccessedAt = $accessedAt,
                    c.accessCount = coalesce(c.accessCount, 0) + 1
                """;
        run(() -> {
            connection.execute(cypher, Map.of("key", key, "accessedAt", accessedAt.toEpochMilli()));
            return null;
        }, key);
    }

    @Override
    public long deleteFetchedBefore(Instant cutoff) {
        String cypher = """
                MATCH (c:CacheEntry)
                WHERE c.fetchedAt < $cutoff
                DELETE c
                RETURN count(c) as deleted
                """;
        List<Map<String, Object>> rows = run(
                () -> connection.query(cypher, Map.of("cutoff", cutoff.toEpochMilli())), "*");
        long deleted = rows.isEmpty() ? 0 : toLong(rows.get(0).get("deleted"));
        log.info("cache.store.swept cutoff={} deleted={}", cutoff, deleted);
        return deleted;
    }

    private CacheEntry mapToEntry(Map<String, Object> row) {
        String key = (String) row.get("key");
        try {
            JsonNode payload = objectMapper.readTree((String) row.get("payload"));
            return new CacheEntry(
                    key,
                    payload,
                    Instant.ofEpochMilli(toLong(row.get("fetchedAt"))),
                    row.get("lastAccessedAt") != null
                            ? Instant.ofEpochMilli(toLong(row.get("lastAccessedAt"))) : null,
                    toLong(row.get("accessCount")));
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException("Unreadable cache payload for key " + key, e);
        }
    }

    private String writePayload(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    private <T> T run(Supplier<T> action, String key) {
        try {
            return action.get();
        } catch (CacheUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache store unavailable for key " + key, e);
        }
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }
}
