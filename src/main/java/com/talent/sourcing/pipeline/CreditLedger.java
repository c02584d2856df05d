package com.talent.sourcing.pipeline;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts metered and free work done during collection. Reported, never enforced.
 * Safe for concurrent updates from collection workers.
 */
public class CreditLedger {

    private final AtomicInteger fetched = new AtomicInteger();
    private final AtomicInteger cached = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger organizationsFetched = new AtomicInteger();
    private final AtomicInteger organizationsCached = new AtomicInteger();

    void recordFetched() {
        fetched.incrementAndGet();
    }

    void recordCached() {
        cached.incrementAndGet();
    }

    void recordSkipped() {
        skipped.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    void recordOrganizationFetched() {
        organizationsFetched.incrementAndGet();
    }

    void recordOrganizationCached() {
        organizationsCached.incrementAndGet();
    }

    /**
     * Candidate records fetched from the provider (1 credit each).
     */
    public int getFetched() {
        return fetched.get();
    }

    /**
     * Candidate records served from cache (free).
     */
    public int getCached() {
        return cached.get();
    }

    /**
     * Organization enrichments skipped by the enrichment policy.
     */
    public int getSkipped() {
        return skipped.get();
    }

    /**
     * Candidates that failed after their retry.
     */
    public int getFailed() {
        return failed.get();
    }

    public int getOrganizationsFetched() {
        return organizationsFetched.get();
    }

    public int getOrganizationsCached() {
        return organizationsCached.get();
    }

    public int creditsSpent() {
        return getFetched() + getOrganizationsFetched();
    }

    @Override
    public String toString() {
        return "CreditLedger{fetched=" + getFetched() + ", cached=" + getCached() + ", skipped=" + getSkipped()
                + ", failed=" + getFailed() + ", organizationsFetched=" + getOrganizationsFetched()
                + ", organizationsCached=" + getOrganizationsCached() + '}';
    }
}
