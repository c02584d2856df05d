package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * View of a cache tier that ignores cached payloads on read but still records
 * fresh fetches. Backs runs started with {@code bypassCache}.
 */
public class WriteThroughOnlyCacheTier implements CacheTier {

    private final CacheTier delegate;

    public WriteThroughOnlyCacheTier(CacheTier delegate) {
        this.delegate = delegate;
    }

    @Override
    public CacheLookup get(String key, FreshnessPolicy policy) {
        return CacheLookup.miss(key);
    }

    @Override
    public void set(String key, JsonNode payload) {
        delegate.set(key, payload);
    }

    @Override
    public CacheStats getStats() {
        return delegate.getStats();
    }
}
