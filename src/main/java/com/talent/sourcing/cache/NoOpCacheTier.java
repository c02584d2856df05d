package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Cache tier that stores nothing and always misses.
 * Used when caching is disabled.
 */
public class NoOpCacheTier implements CacheTier {

    @Override
    public CacheLookup get(String key, FreshnessPolicy policy) {
        return CacheLookup.miss(key);
    }

    @Override
    public void set(String key, JsonNode payload) {
        // nothing to store
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
