package com.talent.sourcing.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.cache.CacheUnavailableException;
import com.talent.sourcing.graph.GraphConnection;
import com.talent.sourcing.lock.DistributedLock;
import com.talent.sourcing.resolver.ResolvedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Session store persisted as {@code :SearchSession} nodes in FalkorDB.
 * Lists and metadata are stored as JSON strings, timestamps as epoch milliseconds.
 * Graph failures surface as {@link CacheUnavailableException}.
 */
public class GraphSessionStateStore extends AbstractSessionStateStore {
    private static final Logger log = LoggerFactory.getLogger(GraphSessionStateStore.class);

    private static final TypeReference<List<ResolvedEntity>> ENTITY_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA = new TypeReference<>() {};

    private static final String RETURN_COLUMNS = """
            RETURN s.sessionId as sessionId, s.stage as stage,
                   s.discoveredEntities as discoveredEntities, s.candidateIds as candidateIds,
                   s.paginationOffset as paginationOffset, s.stageMetadata as stageMetadata,
                   s.active as active, s.createdAt as createdAt, s.updatedAt as updatedAt,
                   s.lastAccessedAt as lastAccessedAt
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphSessionStateStore(GraphConnection connection, ObjectMapper objectMapper,
                                  DistributedLock lock, Clock clock, int candidateIdCap) {
        super(lock, clock, candidateIdCap);
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    @Override
    protected Optional<SessionState> load(String sessionId) {
        String query = "MATCH (s:SearchSession {sessionId: $sessionId})\n" + RETURN_COLUMNS;
        List<Map<String, Object>> rows = graph(() -> connection.query(query, Map.of("sessionId", sessionId)));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToState(rows.get(0)));
    }

    @Override
    protected void save(SessionState state) {
        String query = """
                MERGE (s:SearchSession {sessionId: $sessionId})
                SET s.stage = $stage,
                    s.discoveredEntities = $discoveredEntities,
                    s.candidateIds = $candidateIds,
                    s.paginationOffset = $paginationOffset,
                    s.stageMetadata = $stageMetadata,
                    s.active = $active,
                    s.createdAt = $createdAt,
                    s.updatedAt = $updatedAt,
                    s.lastAccessedAt = $lastAccessedAt
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("sessionId", state.sessionId());
        params.put("stage", state.stage().name());
        params.put("discoveredEntities", toJson(state.discoveredEntities()));
        params.put("candidateIds", toJson(state.candidateIds()));
        params.put("paginationOffset", state.paginationOffset());
        params.put("stageMetadata", toJson(state.stageMetadata()));
        params.put("active", state.active());
        params.put("createdAt", state.createdAt().toEpochMilli());
        params.put("updatedAt", state.updatedAt().toEpochMilli());
        params.put("lastAccessedAt", state.lastAccessedAt().toEpochMilli());
        graph(() -> {
            connection.execute(query, params);
            return null;
        });
    }

    @Override
    public List<SessionSummary> listActive(int limit) {
        String query = "MATCH (s:SearchSession)\nWHERE s.active = true\n" + RETURN_COLUMNS
                + "ORDER BY s.lastAccessedAt DESC\nLIMIT $limit";
        List<Map<String, Object>> rows = graph(() -> connection.query(query, Map.of("limit", limit)));
        return rows.stream().map(this::mapToState).map(SessionSummary::of).toList();
    }

    @Override
    public int purgeInactiveBefore(Instant cutoff) {
        String query = """
                MATCH (s:SearchSession)
                WHERE s.lastAccessedAt < $cutoff
                WITH s, s.sessionId as sessionId
                DELETE s
                RETURN sessionId
                """;
        List<Map<String, Object>> rows = graph(() -> connection.query(query, Map.of("cutoff", cutoff.toEpochMilli())));
        for (Map<String, Object> row : rows) {
            lock.forget((String) row.get("sessionId"));
        }
        int purged = rows.size();
        log.info("session.purged cutoff={} count={}", cutoff, purged);
        return purged;
    }

    private SessionState mapToState(Map<String, Object> row) {
        String sessionId = (String) row.get("sessionId");
        try {
            return new SessionState(
                    sessionId,
                    PipelineStage.fromName((String) row.get("stage")),
                    objectMapper.readValue((String) row.get("discoveredEntities"), ENTITY_LIST),
                    objectMapper.readValue((String) row.get("candidateIds"), ID_LIST),
                    ((Number) row.get("paginationOffset")).intValue(),
                    objectMapper.readValue((String) row.get("stageMetadata"), METADATA),
                    Boolean.TRUE.equals(row.get("active")),
                    Instant.ofEpochMilli(((Number) row.get("createdAt")).longValue()),
                    Instant.ofEpochMilli(((Number) row.get("updatedAt")).longValue()),
                    Instant.ofEpochMilli(((Number) row.get("lastAccessedAt")).longValue()));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new SessionStateCorruptionException("Stored session " + sessionId + " is unreadable", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Session field is not serializable", e);
        }
    }

    private <T> T graph(Supplier<T> action) {
        try {
            return action.get();
        } catch (SessionStateCorruptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Session store unavailable: " + e.getMessage(), e);
        }
    }
}
