package com.talent.sourcing.cache;

/**
 * Cache tier counters.
 *
 * @param freshHits     hits inside the fresh window
 * @param staleHits     hits inside the stale window
 * @param misses        misses, including entries too old to serve
 * @param backendErrors persistent store failures degraded to a miss
 * @param memorySize    entries held in the in-process tier
 */
public record CacheStats(long freshHits, long staleHits, long misses, long backendErrors, long memorySize) {

    /**
     * Returns the hit rate (0.0 to 1.0), counting stale hits as hits.
     */
    public double hitRate() {
        long hits = freshHits + staleHits;
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
