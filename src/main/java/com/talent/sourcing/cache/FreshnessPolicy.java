package com.talent.sourcing.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Two freshness thresholds for one class of cached entity.
 * Entries younger than {@code freshMaxAge} are reused free; entries younger than
 * {@code staleMaxAge} are still served but flagged stale; anything older is a miss
 * and forces a refetch.
 *
 * @param freshMaxAge maximum age for free reuse
 * @param staleMaxAge maximum age at which a stale payload is still acceptable
 */
public record FreshnessPolicy(Duration freshMaxAge, Duration staleMaxAge) {

    public FreshnessPolicy {
        Objects.requireNonNull(freshMaxAge, "freshMaxAge is required");
        Objects.requireNonNull(staleMaxAge, "staleMaxAge is required");
        if (freshMaxAge.isNegative() || freshMaxAge.isZero()) {
            throw new IllegalArgumentException("freshMaxAge must be positive");
        }
        if (staleMaxAge.compareTo(freshMaxAge) < 0) {
            throw new IllegalArgumentException("staleMaxAge must be >= freshMaxAge");
        }
    }

    /**
     * Candidate records: 3 days fresh, stale but acceptable up to 90 days.
     */
    public static FreshnessPolicy candidateRecords() {
        return new FreshnessPolicy(Duration.ofDays(3), Duration.ofDays(90));
    }

    /**
     * Organization records and lookups: 30 days, no stale window.
     */
    public static FreshnessPolicy organizations() {
        return of(Duration.ofDays(30));
    }

    /**
     * Candidate search results: 7 days, no stale window.
     */
    public static FreshnessPolicy searchResults() {
        return of(Duration.ofDays(7));
    }

    /**
     * Single-threshold policy.
     */
    public static FreshnessPolicy of(Duration maxAge) {
        return new FreshnessPolicy(maxAge, maxAge);
    }

    /**
     * Classifies a payload age against both thresholds.
     */
    public CacheLookup.Outcome classify(Duration age) {
        if (age.compareTo(freshMaxAge) < 0) {
            return CacheLookup.Outcome.FRESH_HIT;
        }
        if (age.compareTo(staleMaxAge) < 0) {
            return CacheLookup.Outcome.STALE_HIT;
        }
        return CacheLookup.Outcome.MISS;
    }
}
