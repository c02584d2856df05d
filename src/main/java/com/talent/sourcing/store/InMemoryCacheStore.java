package com.talent.sourcing.store;

import com.talent.sourcing.cache.CacheEntry;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Cache store held in a {@link ConcurrentHashMap}. Suitable for tests and
 * single-process deployments.
 */
public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> load(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void save(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public void touch(String key, Instant accessedAt) {
        entries.computeIfPresent(key, (k, entry) -> entry.accessed(accessedAt));
    }

    @Override
    public long deleteFetchedBefore(Instant cutoff) {
        long before = entries.size();
        entries.values().removeIf(entry -> entry.fetchedAt().isBefore(cutoff));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
