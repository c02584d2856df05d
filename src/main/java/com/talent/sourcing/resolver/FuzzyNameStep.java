package com.talent.sourcing.resolver;

import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.provider.OrganizationMatch;
import com.talent.sourcing.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tier 3: scores every search result against the query and accepts the best
 * one at or above the confidence threshold. Ties keep the earlier result.
 */
public class FuzzyNameStep implements ResolutionStep {
    private static final Logger log = LoggerFactory.getLogger(FuzzyNameStep.class);

    private final EntitySearchProvider provider;
    private final SimilarityAlgorithm similarity;
    private final int searchLimit;

    public FuzzyNameStep(EntitySearchProvider provider, SimilarityAlgorithm similarity, int searchLimit) {
        this.provider = provider;
        this.similarity = similarity;
        this.searchLimit = searchLimit;
    }

    @Override
    public ResolutionTier tier() {
        return ResolutionTier.FUZZY;
    }

    @Override
    public Optional<TierMatch> attempt(ResolutionRequest request, double confidenceThreshold) {
        OrganizationMatch best = null;
        double bestScore = 0.0;
        for (OrganizationMatch candidate : provider.searchByName(request.name(), searchLimit)) {
            double score = similarity.compute(request.name(), candidate.name());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < confidenceThreshold) {
            log.debug("resolve.fuzzy.rejected name='{}' bestScore={} threshold={}",
                    request.name(), bestScore, confidenceThreshold);
            return Optional.empty();
        }
        return Optional.of(new TierMatch(ResolutionTier.FUZZY, best, bestScore));
    }
}
