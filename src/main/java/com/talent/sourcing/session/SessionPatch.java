package com.talent.sourcing.session;

import com.talent.sourcing.resolver.ResolvedEntity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A partial update to a {@link SessionState}. Fields left unset keep their stored value;
 * metadata entries are merged into the stored metadata key by key.
 */
public class SessionPatch {

    private final PipelineStage stage;
    private final List<ResolvedEntity> discoveredEntities;
    private final Map<String, Object> metadata;

    private SessionPatch(Builder builder) {
        this.stage = builder.stage;
        this.discoveredEntities = builder.discoveredEntities != null ? List.copyOf(builder.discoveredEntities) : null;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public PipelineStage getStage() {
        return stage;
    }

    public List<ResolvedEntity> getDiscoveredEntities() {
        return discoveredEntities;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Applies this patch to {@code current} without modifying it.
     *
     * @throws IllegalStateException if the patch requests an invalid stage transition
     */
    public SessionState applyTo(SessionState current) {
        PipelineStage nextStage = current.stage();
        if (stage != null && stage != current.stage()) {
            if (!current.stage().canTransitionTo(stage)) {
                throw new IllegalStateException("Invalid stage transition for session "
                        + current.sessionId() + ": " + current.stage() + " -> " + stage);
            }
            nextStage = stage;
        }
        List<ResolvedEntity> entities = discoveredEntities != null ? discoveredEntities : current.discoveredEntities();
        Map<String, Object> merged = new LinkedHashMap<>(current.stageMetadata());
        merged.putAll(metadata);
        return current.withStageAndEntities(nextStage, entities, merged);
    }

    public static SessionPatch stage(PipelineStage stage) {
        return builder().stage(stage).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineStage stage;
        private List<ResolvedEntity> discoveredEntities;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder stage(PipelineStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder discoveredEntities(List<ResolvedEntity> discoveredEntities) {
            this.discoveredEntities = discoveredEntities;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> entries) {
            this.metadata.putAll(entries);
            return this;
        }

        public SessionPatch build() {
            return new SessionPatch(this);
        }
    }
}
