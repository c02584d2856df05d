package com.talent.sourcing.rest.dto;

import com.talent.sourcing.resolver.ResolvedEntity;
import com.talent.sourcing.session.SessionState;
import com.talent.sourcing.session.SessionSummary;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a session: its progress summary, discovered organizations and stage metadata.
 */
public record SessionResponse(
        SessionSummary summary,
        List<ResolvedEntity> discoveredEntities,
        Map<String, Object> stageMetadata
) {
    public static SessionResponse from(SessionState state) {
        return new SessionResponse(SessionSummary.of(state), state.discoveredEntities(), state.stageMetadata());
    }
}
