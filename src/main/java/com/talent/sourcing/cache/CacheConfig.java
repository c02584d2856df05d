package com.talent.sourcing.cache;

/**
 * Configuration for the in-process tier of the cache.
 *
 * @param memoryMaxSize    maximum number of entries held in memory
 * @param memoryTtlSeconds how long an entry stays in memory before re-reading the persistent store
 * @param enabled          whether caching is enabled
 */
public record CacheConfig(int memoryMaxSize, int memoryTtlSeconds, boolean enabled) {

    public CacheConfig {
        if (memoryMaxSize <= 0) {
            throw new IllegalArgumentException("memoryMaxSize must be > 0");
        }
        if (memoryTtlSeconds <= 0) {
            throw new IllegalArgumentException("memoryTtlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, 300s in-memory TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 300, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
