package com.talent.sourcing.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * How long sessions and cached payloads are kept.
 *
 * @param sessionRetention    sessions not accessed for this long are deleted
 * @param cacheEntryRetention cached payloads fetched this long ago are deleted
 */
public record RetentionPolicy(Duration sessionRetention, Duration cacheEntryRetention) {

    public RetentionPolicy {
        Objects.requireNonNull(sessionRetention, "sessionRetention is required");
        Objects.requireNonNull(cacheEntryRetention, "cacheEntryRetention is required");
        if (sessionRetention.isNegative() || sessionRetention.isZero()) {
            throw new IllegalArgumentException("sessionRetention must be positive");
        }
        if (cacheEntryRetention.isNegative() || cacheEntryRetention.isZero()) {
            throw new IllegalArgumentException("cacheEntryRetention must be positive");
        }
    }

    /**
     * 90 days for both. Cached candidate records are never served past 90 days anyway.
     */
    public static RetentionPolicy defaults() {
        return new RetentionPolicy(Duration.ofDays(90), Duration.ofDays(90));
    }
}
