package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached payload for one external identity.
 *
 * @param key            the entity identity (e.g. {@code candidate:123}, {@code org:acme.com})
 * @param payload        the fetched payload
 * @param fetchedAt      when the payload was fetched from the external provider
 * @param lastAccessedAt when the entry was last served from cache
 * @param accessCount    number of times the entry was served from cache
 */
public record CacheEntry(String key, JsonNode payload, Instant fetchedAt,
                         Instant lastAccessedAt, long accessCount) {

    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        if (lastAccessedAt == null) {
            lastAccessedAt = fetchedAt;
        }
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount must be >= 0");
        }
    }

    /**
     * Creates an entry for a payload that was just fetched.
     */
    public static CacheEntry fetched(String key, JsonNode payload, Instant now) {
        return new CacheEntry(key, payload, now, now, 0);
    }

    /**
     * Returns a copy recording one more cache hit at {@code now}.
     */
    public CacheEntry accessed(Instant now) {
        return new CacheEntry(key, payload, fetchedAt, now, accessCount + 1);
    }

    /**
     * Age of the payload relative to {@code now}. Never negative.
     */
    public Duration ageAt(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
