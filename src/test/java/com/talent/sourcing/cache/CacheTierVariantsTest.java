package com.talent.sourcing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.store.InMemoryCacheStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CacheTierVariantsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("WriteThroughOnlyCacheTier")
    class WriteThroughOnly {

        @Test
        @DisplayName("Reads always miss but writes reach the delegate")
        void readsMissWritesPass() {
            TieredCacheTier delegate = new TieredCacheTier("d", new InMemoryCacheStore(), CacheConfig.defaults());
            delegate.set("k", mapper.createObjectNode().put("v", 1));
            WriteThroughOnlyCacheTier bypass = new WriteThroughOnlyCacheTier(delegate);

            assertFalse(bypass.get("k", FreshnessPolicy.searchResults()).isHit());

            bypass.set("k2", mapper.createObjectNode().put("v", 2));
            assertTrue(delegate.get("k2", FreshnessPolicy.searchResults()).isHit());
        }
    }

    @Nested
    @DisplayName("NoOpCacheTier")
    class NoOp {

        @Test
        @DisplayName("Never stores anything")
        void neverStores() {
            NoOpCacheTier tier = new NoOpCacheTier();
            tier.set("k", mapper.createObjectNode());
            assertFalse(tier.get("k", FreshnessPolicy.searchResults()).isHit());
        }
    }

    @Nested
    @DisplayName("FreshnessPolicy")
    class Policy {

        @Test
        @DisplayName("Classifies ages against both thresholds")
        void classify() {
            FreshnessPolicy policy = FreshnessPolicy.candidateRecords();
            assertEquals(CacheLookup.Outcome.FRESH_HIT, policy.classify(Duration.ofDays(2)));
            assertEquals(CacheLookup.Outcome.STALE_HIT, policy.classify(Duration.ofDays(3)));
            assertEquals(CacheLookup.Outcome.STALE_HIT, policy.classify(Duration.ofDays(89)));
            assertEquals(CacheLookup.Outcome.MISS, policy.classify(Duration.ofDays(90)));
        }

        @Test
        @DisplayName("Rejects a stale window shorter than the fresh window")
        void rejectsInvertedWindows() {
            assertThrows(IllegalArgumentException.class,
                    () -> new FreshnessPolicy(Duration.ofDays(7), Duration.ofDays(1)));
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class Config {

        @Test
        @DisplayName("Defaults are enabled with 10000 entries and 300 seconds")
        void defaults() {
            CacheConfig config = CacheConfig.defaults();
            assertTrue(config.enabled());
            assertEquals(10000, config.memoryMaxSize());
            assertEquals(300, config.memoryTtlSeconds());
        }
    }
}
