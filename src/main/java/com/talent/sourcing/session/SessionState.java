package com.talent.sourcing.session;

import com.talent.sourcing.resolver.ResolvedEntity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable state of one sourcing run. Instances are immutable; stores produce a new
 * instance for every update.
 *
 * @param sessionId          the run id
 * @param stage              current pipeline stage
 * @param discoveredEntities organizations resolved during discovery, in seed order
 * @param candidateIds       candidate ids found during preview, deduplicated, in first-seen order
 * @param paginationOffset   number of candidate ids already collected
 * @param stageMetadata      per-stage metadata, shallow-merged on update
 * @param active             false once the session has been cleared
 * @param createdAt          creation time
 * @param updatedAt          time of the last write
 * @param lastAccessedAt     time of the last read or write
 */
public record SessionState(String sessionId,
                           PipelineStage stage,
                           List<ResolvedEntity> discoveredEntities,
                           List<String> candidateIds,
                           int paginationOffset,
                           Map<String, Object> stageMetadata,
                           boolean active,
                           Instant createdAt,
                           Instant updatedAt,
                           Instant lastAccessedAt) {

    public SessionState {
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        discoveredEntities = discoveredEntities != null ? List.copyOf(discoveredEntities) : List.of();
        candidateIds = candidateIds != null ? List.copyOf(candidateIds) : List.of();
        stageMetadata = stageMetadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stageMetadata)) : Map.of();
        updatedAt = updatedAt != null ? updatedAt : createdAt;
        lastAccessedAt = lastAccessedAt != null ? lastAccessedAt : updatedAt;
    }

    /**
     * A new, active session in {@link PipelineStage#DISCOVERY}.
     */
    public static SessionState initial(String sessionId, Instant now) {
        return new SessionState(sessionId, PipelineStage.DISCOVERY, List.of(), List.of(), 0,
                Map.of(), true, now, now, now);
    }

    /**
     * Number of candidate ids not yet collected.
     */
    public int remaining() {
        return candidateIds.size() - paginationOffset;
    }

    /**
     * Returns a description of the first violated invariant, or {@code null} if the state is consistent.
     */
    public String invariantViolation() {
        if (paginationOffset < 0) {
            return "paginationOffset is negative: " + paginationOffset;
        }
        if (paginationOffset > candidateIds.size()) {
            return "paginationOffset " + paginationOffset + " exceeds candidate count " + candidateIds.size();
        }
        return null;
    }

    SessionState withStageAndEntities(PipelineStage newStage, List<ResolvedEntity> entities,
                                      Map<String, Object> metadata) {
        return new SessionState(sessionId, newStage, entities, candidateIds, paginationOffset, metadata,
                active, createdAt, updatedAt, lastAccessedAt);
    }

    SessionState withCandidateIds(List<String> ids) {
        return new SessionState(sessionId, stage, discoveredEntities, ids, paginationOffset, stageMetadata,
                active, createdAt, updatedAt, lastAccessedAt);
    }

    SessionState withPaginationOffset(int offset) {
        return new SessionState(sessionId, stage, discoveredEntities, candidateIds, offset, stageMetadata,
                active, createdAt, updatedAt, lastAccessedAt);
    }

    SessionState withActive(boolean newActive) {
        return new SessionState(sessionId, stage, discoveredEntities, candidateIds, paginationOffset,
                stageMetadata, newActive, createdAt, updatedAt, lastAccessedAt);
    }

    SessionState written(Instant now) {
        return new SessionState(sessionId, stage, discoveredEntities, candidateIds, paginationOffset,
                stageMetadata, active, createdAt, now, now);
    }

    SessionState accessed(Instant now) {
        return new SessionState(sessionId, stage, discoveredEntities, candidateIds, paginationOffset,
                stageMetadata, active, createdAt, updatedAt, now);
    }
}
