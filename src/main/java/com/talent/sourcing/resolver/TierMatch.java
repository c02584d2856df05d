package com.talent.sourcing.resolver;

import com.talent.sourcing.provider.OrganizationMatch;

import java.util.Objects;

/**
 * A successful match produced by one resolution tier.
 */
public record TierMatch(ResolutionTier tier, OrganizationMatch match, double confidence) {

    public TierMatch {
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(match, "match is required");
        if (confidence <= 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in (0, 1], got " + confidence);
        }
    }
}
