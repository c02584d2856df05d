package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Uniform get/set interface over cached external payloads, keyed by entity identity.
 * Implementations never let a backend outage block the caller: failures degrade
 * to a {@link CacheLookup.Outcome#MISS}.
 */
public interface CacheTier {

    /**
     * Looks up a payload and classifies it against the caller's freshness policy.
     * A hit updates the entry's access count and last-accessed time.
     *
     * @param key    the entity identity
     * @param policy freshness thresholds for this entity class
     * @return the lookup outcome, never {@code null}
     */
    CacheLookup get(String key, FreshnessPolicy policy);

    /**
     * Stores a freshly fetched payload. Concurrent writes of the same key are
     * last-write-wins.
     */
    void set(String key, JsonNode payload);

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
