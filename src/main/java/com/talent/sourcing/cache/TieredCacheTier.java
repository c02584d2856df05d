package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine memory tier in front of a persistent {@link CacheStore}.
 * Memory misses read through to the store and populate memory; writes go to both.
 * Any store failure is logged, counted and degraded to a miss.
 */
public class TieredCacheTier implements CacheTier {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheTier.class);

    private final String name;
    private final Cache<String, CacheEntry> memory;
    private final CacheStore store;
    private final Clock clock;
    private final MetricsService metrics;

    private final AtomicLong freshHits = new AtomicLong();
    private final AtomicLong staleHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong backendErrors = new AtomicLong();
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public TieredCacheTier(String name, CacheStore store, CacheConfig config) {
        this(name, store, config, Clock.systemUTC(), new NoOpMetricsService());
    }

    public TieredCacheTier(String name, CacheStore store, CacheConfig config,
                           Clock clock, MetricsService metrics) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.memory = Caffeine.newBuilder()
                .maximumSize(config.memoryMaxSize())
                .expireAfterWrite(Duration.ofSeconds(config.memoryTtlSeconds()))
                .build();
        log.info("cache.initialized name={} memoryMaxSize={} memoryTtl={}s",
                name, config.memoryMaxSize(), config.memoryTtlSeconds());
    }

    @Override
    public CacheLookup get(String key, FreshnessPolicy policy) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(policy, "policy is required");

        CacheEntry entry = memory.getIfPresent(key);
        if (entry == null) {
            try {
                Optional<CacheEntry> stored = store.load(key);
                if (stored.isPresent()) {
                    // a concurrent set() may have landed while the store was read
                    CacheEntry current = memory.asMap().putIfAbsent(key, stored.get());
                    entry = current != null ? current : stored.get();
                }
            } catch (RuntimeException e) {
                recordBackendError("load", key, e);
                return miss(key);
            }
        }
        if (entry == null) {
            return miss(key);
        }

        Instant now = clock.instant();
        Duration age = entry.ageAt(now);
        CacheLookup.Outcome outcome = policy.classify(age);
        if (outcome == CacheLookup.Outcome.MISS) {
            log.debug("cache.expired name={} key={} ageDays={}", name, key, age.toDays());
            return miss(key);
        }

        CacheEntry read = entry;
        CacheEntry accessed = entry.accessed(now);
        memory.asMap().computeIfPresent(key, (k, current) -> current == read ? accessed : current);
        try {
            store.touch(key, now);
        } catch (RuntimeException e) {
            recordBackendError("touch", key, e);
        }

        if (outcome == CacheLookup.Outcome.FRESH_HIT) {
            freshHits.incrementAndGet();
        } else {
            staleHits.incrementAndGet();
        }
        metrics.recordCacheLookup(name, outcome);
        log.debug("cache.hit name={} key={} outcome={} ageDays={}", name, key, outcome, age.toDays());
        return CacheLookup.hit(accessed, outcome, age);
    }

    @Override
    public void set(String key, JsonNode payload) {
        CacheEntry entry = CacheEntry.fetched(key, payload, clock.instant());
        memory.put(key, entry);
        try {
            store.save(entry);
            degraded.set(false);
        } catch (RuntimeException e) {
            recordBackendError("save", key, e);
        }
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(freshHits.get(), staleHits.get(), misses.get(),
                backendErrors.get(), memory.estimatedSize());
    }

    /**
     * Whether the last persistent-store write failed.
     */
    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * Drops the in-memory copy of every entry. The persistent store is untouched.
     */
    public void clearMemory() {
        memory.invalidateAll();
    }

    public String getName() {
        return name;
    }

    private CacheLookup miss(String key) {
        misses.incrementAndGet();
        metrics.recordCacheLookup(name, CacheLookup.Outcome.MISS);
        return CacheLookup.miss(key);
    }

    private void recordBackendError(String operation, String key, RuntimeException e) {
        backendErrors.incrementAndGet();
        degraded.set(true);
        metrics.recordCacheBackendError(name);
        log.warn("cache.backend.error name={} operation={} key={} error={}",
                name, operation, key, e.getMessage());
    }
}
