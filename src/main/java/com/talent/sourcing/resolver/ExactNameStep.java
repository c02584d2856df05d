package com.talent.sourcing.resolver;

import com.talent.sourcing.provider.EntitySearchProvider;

import java.util.Optional;

/**
 * Tier 2: accepts a search result whose name equals the query, ignoring case.
 */
public class ExactNameStep implements ResolutionStep {

    static final double CONFIDENCE = 0.95;

    private final EntitySearchProvider provider;
    private final int searchLimit;

    public ExactNameStep(EntitySearchProvider provider, int searchLimit) {
        this.provider = provider;
        this.searchLimit = searchLimit;
    }

    @Override
    public ResolutionTier tier() {
        return ResolutionTier.EXACT_NAME;
    }

    @Override
    public Optional<TierMatch> attempt(ResolutionRequest request, double confidenceThreshold) {
        return provider.searchByName(request.name(), searchLimit).stream()
                .filter(match -> match.name().trim().equalsIgnoreCase(request.name()))
                .findFirst()
                .map(match -> new TierMatch(ResolutionTier.EXACT_NAME, match, CONFIDENCE));
    }
}
