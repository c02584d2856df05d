package com.talent.sourcing.resolver;

import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.pipeline.BoundedExecutor;
import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.review.InMemoryManualResolutionQueue;
import com.talent.sourcing.review.ManualResolutionQueue;
import com.talent.sourcing.similarity.OrganizationNameSimilarity;
import com.talent.sourcing.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves organization names to canonical provider ids.
 *
 * <p>Resolution is a first-success fold over the ordered tiers: exact website key,
 * exact name, then confidence-scored fuzzy name. A tier that throws is logged and
 * skipped. When no tier matches, the entity is returned unresolved (never dropped)
 * and queued for manual resolution.</p>
 *
 * <pre>
 * try (EntityResolver resolver = EntityResolver.builder()
 *         .searchProvider(new CachingEntitySearchProvider(provider, cacheTier))
 *         .build()) {
 *     ResolvedEntity acme = resolver.resolve("Acme", "https://www.acme.com/about");
 * }
 * </pre>
 */
public class EntityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final List<ResolutionStep> steps;
    private final ResolutionOptions options;
    private final ManualResolutionQueue reviewQueue;
    private final MetricsService metrics;
    private final BoundedExecutor executor;

    private EntityResolver(Builder builder) {
        this.options = builder.options;
        this.reviewQueue = builder.reviewQueue;
        this.metrics = builder.metrics;
        this.steps = builder.steps != null ? List.copyOf(builder.steps) : List.of(
                new ExactKeyStep(builder.searchProvider),
                new ExactNameStep(builder.searchProvider, options.getSearchLimit()),
                new FuzzyNameStep(builder.searchProvider, builder.similarity, options.getSearchLimit()));
        this.executor = new BoundedExecutor(options.getParallelism(), "resolver");
    }

    public ResolvedEntity resolve(String name, String website) {
        return resolve(ResolutionRequest.of(name, website), options.getConfidenceThreshold(), null);
    }

    public ResolvedEntity resolve(String name, String website, double confidenceThreshold) {
        return resolve(ResolutionRequest.of(name, website), confidenceThreshold, null);
    }

    /**
     * Resolves one organization.
     *
     * @param request             the name and optional website
     * @param confidenceThreshold minimum fuzzy score accepted by tier 3
     * @param sessionId           session to attribute manual-resolution items to, may be {@code null}
     * @return the resolved or unresolved entity, never {@code null}
     */
    public ResolvedEntity resolve(ResolutionRequest request, double confidenceThreshold, String sessionId) {
        Objects.requireNonNull(request, "request is required");
        if (confidenceThreshold <= 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in (0, 1]");
        }
        if (request.name().isEmpty()) {
            log.debug("resolve.skipped reason=blank-name");
            return record(ResolvedEntity.unresolved(request));
        }

        for (ResolutionStep step : steps) {
            Optional<TierMatch> match = attempt(step, request, confidenceThreshold);
            if (match.isPresent()) {
                ResolvedEntity resolved = ResolvedEntity.resolved(request, match.get());
                log.debug("resolve.matched name='{}' tier={} canonicalId={} confidence={}",
                        request.name(), resolved.tierNumber(), resolved.canonicalId(), resolved.confidence());
                return record(resolved);
            }
        }

        ResolvedEntity unresolved = ResolvedEntity.unresolved(request);
        log.info("resolve.unresolved name='{}' website={}", request.name(), request.website());
        if (options.isSubmitUnresolvedForReview()) {
            reviewQueue.submit(unresolved, sessionId);
        }
        return record(unresolved);
    }

    /**
     * Resolves every request with bounded parallelism. The result has the same
     * size and order as {@code requests}.
     */
    public List<ResolvedEntity> resolveAll(List<ResolutionRequest> requests) {
        return resolveAll(requests, null);
    }

    public List<ResolvedEntity> resolveAll(List<ResolutionRequest> requests, String sessionId) {
        double threshold = options.getConfidenceThreshold();
        List<ResolvedEntity> results = executor.mapOrdered(requests,
                request -> resolve(request, threshold, sessionId));
        long resolved = results.stream().filter(ResolvedEntity::isResolved).count();
        log.info("resolve.batch.completed total={} resolved={} unresolved={}",
                results.size(), resolved, results.size() - resolved);
        return results;
    }

    public ManualResolutionQueue getReviewQueue() {
        return reviewQueue;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        executor.close();
    }

    private Optional<TierMatch> attempt(ResolutionStep step, ResolutionRequest request, double threshold) {
        try {
            return step.attempt(request, threshold);
        } catch (RuntimeException e) {
            log.warn("resolve.tier.failed tier={} name='{}' error={}",
                    step.tier().number(), request.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private ResolvedEntity record(ResolvedEntity entity) {
        metrics.recordResolution(entity.method());
        return entity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntitySearchProvider searchProvider;
        private SimilarityAlgorithm similarity = new OrganizationNameSimilarity();
        private List<ResolutionStep> steps;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private ManualResolutionQueue reviewQueue = new InMemoryManualResolutionQueue();
        private MetricsService metrics = new NoOpMetricsService();

        public Builder searchProvider(EntitySearchProvider searchProvider) {
            this.searchProvider = searchProvider;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        /**
         * Replaces the default tiers.
         */
        public Builder steps(List<ResolutionStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder reviewQueue(ManualResolutionQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public EntityResolver build() {
            if (steps == null) {
                Objects.requireNonNull(searchProvider, "searchProvider is required");
            }
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(reviewQueue, "reviewQueue is required");
            Objects.requireNonNull(metrics, "metrics is required");
            return new EntityResolver(this);
        }
    }
}
