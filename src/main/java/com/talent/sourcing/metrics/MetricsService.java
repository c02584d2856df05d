package com.talent.sourcing.metrics;

import com.talent.sourcing.cache.CacheLookup;
import com.talent.sourcing.resolver.ResolutionMethod;
import com.talent.sourcing.session.PipelineStage;

import java.time.Duration;

/**
 * Interface for recording sourcing pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, ensuring the pipeline works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheLookup(String cacheName, CacheLookup.Outcome outcome);

    void recordCacheBackendError(String cacheName);

    void recordCreditSpent(String resourceKind);

    void recordResolution(ResolutionMethod method);

    void recordStageDuration(PipelineStage stage, Duration duration);

    void recordItemFailure(PipelineStage stage);

    void recordPageSize(int size);
}
