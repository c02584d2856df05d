package com.talent.sourcing.pipeline;

import com.talent.sourcing.resolver.ResolutionRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of a new sourcing run: the seed organizations to discover and, optionally,
 * the candidate criteria and requirements used by the later stages.
 */
public class RunRequest {

    private final String sessionId;
    private final List<ResolutionRequest> seeds;
    private final SearchCriteria criteria;
    private final Requirements requirements;
    private final boolean bypassCache;

    private RunRequest(Builder builder) {
        this.sessionId = builder.sessionId;
        this.seeds = List.copyOf(builder.seeds);
        this.criteria = builder.criteria != null ? builder.criteria : SearchCriteria.defaults();
        this.requirements = builder.requirements;
        this.bypassCache = builder.bypassCache;
    }

    /**
     * Caller-chosen session id, or {@code null} to generate one.
     */
    public String getSessionId() {
        return sessionId;
    }

    public List<ResolutionRequest> getSeeds() {
        return seeds;
    }

    public SearchCriteria getCriteria() {
        return criteria;
    }

    /**
     * Evaluation requirements, may be {@code null} when the caller evaluates separately.
     */
    public Requirements getRequirements() {
        return requirements;
    }

    /**
     * When set, cache reads are skipped but fresh results are still written.
     */
    public boolean isBypassCache() {
        return bypassCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sessionId;
        private final List<ResolutionRequest> seeds = new ArrayList<>();
        private SearchCriteria criteria;
        private Requirements requirements;
        private boolean bypassCache;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder seed(String name, String website) {
            this.seeds.add(ResolutionRequest.of(name, website));
            return this;
        }

        public Builder seeds(List<ResolutionRequest> seeds) {
            this.seeds.addAll(seeds);
            return this;
        }

        public Builder criteria(SearchCriteria criteria) {
            this.criteria = criteria;
            return this;
        }

        public Builder requirements(Requirements requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder bypassCache(boolean bypassCache) {
            this.bypassCache = bypassCache;
            return this;
        }

        public RunRequest build() {
            if (seeds.isEmpty()) {
                throw new IllegalArgumentException("at least one seed organization is required");
            }
            if (sessionId != null && sessionId.isBlank()) {
                throw new IllegalArgumentException("sessionId must not be blank");
            }
            return new RunRequest(this);
        }
    }
}
