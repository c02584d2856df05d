package com.talent.sourcing.pipeline;

import com.talent.sourcing.resolver.ResolvedEntity;

import java.util.List;

/**
 * Outcome of the discovery stage. {@code entities} has one entry per seed, in seed order.
 */
public record DiscoveryResult(String sessionId, List<ResolvedEntity> entities) {

    public DiscoveryResult {
        entities = List.copyOf(entities);
    }

    public long resolvedCount() {
        return entities.stream().filter(ResolvedEntity::isResolved).count();
    }

    public List<ResolvedEntity> unresolved() {
        return entities.stream().filter(ResolvedEntity::needsManualResolution).toList();
    }
}
