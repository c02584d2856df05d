package com.talent.sourcing.session;

import java.time.Instant;

/**
 * Progress summary of one session.
 *
 * @param sessionId            the run id
 * @param stage                current stage
 * @param active               whether the session is still active
 * @param discoveredCount      organizations discovered
 * @param candidateCount       candidate ids found
 * @param paginationOffset     candidate ids already collected
 * @param remaining            candidate ids not yet collected
 * @param completionPercentage collected share of candidate ids, 0 to 100
 * @param createdAt            creation time
 * @param lastAccessedAt       last read or write
 */
public record SessionSummary(String sessionId, PipelineStage stage, boolean active, int discoveredCount,
                             int candidateCount, int paginationOffset, int remaining,
                             double completionPercentage, Instant createdAt, Instant lastAccessedAt) {

    public static SessionSummary of(SessionState state) {
        int total = state.candidateIds().size();
        double completion = total == 0 ? 0.0
                : Math.round(state.paginationOffset() * 1000.0 / total) / 10.0;
        return new SessionSummary(state.sessionId(), state.stage(), state.active(),
                state.discoveredEntities().size(), total, state.paginationOffset(), state.remaining(),
                completion, state.createdAt(), state.lastAccessedAt());
    }
}
