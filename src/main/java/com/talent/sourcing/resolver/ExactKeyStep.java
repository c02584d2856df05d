package com.talent.sourcing.resolver;

import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.rules.WebsiteNormalizer;

import java.util.Optional;

/**
 * Tier 1: looks the organization up by its normalized website domain.
 */
public class ExactKeyStep implements ResolutionStep {

    private final EntitySearchProvider provider;

    public ExactKeyStep(EntitySearchProvider provider) {
        this.provider = provider;
    }

    @Override
    public ResolutionTier tier() {
        return ResolutionTier.EXACT_KEY;
    }

    @Override
    public Optional<TierMatch> attempt(ResolutionRequest request, double confidenceThreshold) {
        return WebsiteNormalizer.normalize(request.website())
                .flatMap(provider::findByWebsite)
                .map(match -> new TierMatch(ResolutionTier.EXACT_KEY, match, 1.0));
    }
}
