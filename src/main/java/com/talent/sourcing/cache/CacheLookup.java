package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of a {@link CacheTier#get} call.
 *
 * @param key     the looked-up key
 * @param outcome fresh hit, stale hit or miss
 * @param payload the cached payload, {@code null} on a miss
 * @param age     age of the served payload, {@code null} on a miss
 */
public record CacheLookup(String key, Outcome outcome, JsonNode payload, Duration age) {

    public enum Outcome {
        /** Within the fresh window: reuse at zero cost. */
        FRESH_HIT,
        /** Older than the fresh window but inside the stale window: caller decides. */
        STALE_HIT,
        /** Absent, too old, or backend unavailable: caller must fetch and set. */
        MISS
    }

    public static CacheLookup miss(String key) {
        return new CacheLookup(key, Outcome.MISS, null, null);
    }

    static CacheLookup hit(CacheEntry entry, Outcome outcome, Duration age) {
        return new CacheLookup(entry.key(), outcome, entry.payload(), age);
    }

    public boolean isHit() {
        return outcome != Outcome.MISS;
    }

    public boolean isStale() {
        return outcome == Outcome.STALE_HIT;
    }

    public Optional<JsonNode> payloadIfHit() {
        return isHit() ? Optional.of(payload) : Optional.empty();
    }

    /**
     * Whole days since the payload was fetched; 0 on a miss.
     */
    public long ageDays() {
        return age == null ? 0 : age.toDays();
    }
}
