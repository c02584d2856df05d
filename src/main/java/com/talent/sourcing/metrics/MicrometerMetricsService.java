package com.talent.sourcing.metrics;

import com.talent.sourcing.cache.CacheLookup;
import com.talent.sourcing.resolver.ResolutionMethod;
import com.talent.sourcing.session.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sourcing.cache.lookup} - Counter (tags: cache, outcome)</li>
 *   <li>{@code sourcing.cache.backend.error} - Counter (tag: cache)</li>
 *   <li>{@code sourcing.credits.spent} - Counter (tag: resource)</li>
 *   <li>{@code sourcing.resolution} - Counter (tag: method)</li>
 *   <li>{@code sourcing.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code sourcing.item.failure} - Counter (tag: stage)</li>
 *   <li>{@code sourcing.page.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary pageSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pageSizeSummary = DistributionSummary.builder("sourcing.page.size")
                .description("Number of candidate ids requested per collection page")
                .register(registry);
    }

    @Override
    public void recordCacheLookup(String cacheName, CacheLookup.Outcome outcome) {
        counter("sourcing.cache.lookup", "Cache lookups by outcome",
                "cache", cacheName, "outcome", outcome.name()).increment();
    }

    @Override
    public void recordCacheBackendError(String cacheName) {
        counter("sourcing.cache.backend.error", "Persistent cache backend failures degraded to a miss",
                "cache", cacheName, null, null).increment();
    }

    @Override
    public void recordCreditSpent(String resourceKind) {
        counter("sourcing.credits.spent", "Metered external fetches",
                "resource", resourceKind, null, null).increment();
    }

    @Override
    public void recordResolution(ResolutionMethod method) {
        counter("sourcing.resolution", "Organization resolutions by method",
                "method", method.name(), null, null).increment();
    }

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage.name(), k ->
                Timer.builder("sourcing.stage.duration")
                        .description("Duration of pipeline stage executions")
                        .tag("stage", stage.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordItemFailure(PipelineStage stage) {
        counter("sourcing.item.failure", "Items dropped from a stage after retry",
                "stage", stage.name(), null, null).increment();
    }

    @Override
    public void recordPageSize(int size) {
        pageSizeSummary.record(size);
    }

    private Counter counter(String name, String description,
                            String tagKey, String tagValue, String tagKey2, String tagValue2) {
        String key = name + ":" + tagValue + ":" + tagValue2;
        return counterCache.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name)
                    .description(description)
                    .tag(tagKey, tagValue);
            if (tagKey2 != null) {
                builder.tag(tagKey2, tagValue2);
            }
            return builder.register(registry);
        });
    }
}
