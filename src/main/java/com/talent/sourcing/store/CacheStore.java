package com.talent.sourcing.store;

import com.talent.sourcing.cache.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistent key-value store behind the cache tier.
 * Implementations throw {@link com.talent.sourcing.cache.CacheUnavailableException}
 * when the backend cannot be reached.
 */
public interface CacheStore {

    Optional<CacheEntry> load(String key);

    /**
     * Inserts or replaces the entry for {@code entry.key()}.
     */
    void save(CacheEntry entry);

    /**
     * Records one cache hit: increments the access count and sets the last-accessed time.
     * A missing key is ignored.
     */
    void touch(String key, Instant accessedAt);

    /**
     * Deletes entries fetched before {@code cutoff}.
     *
     * @return number of entries deleted
     */
    long deleteFetchedBefore(Instant cutoff);
}
