package com.talent.sourcing.metrics;

import com.talent.sourcing.cache.CacheLookup;
import com.talent.sourcing.resolver.ResolutionMethod;
import com.talent.sourcing.session.PipelineStage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheLookup(String cacheName, CacheLookup.Outcome outcome) {
    }

    @Override
    public void recordCacheBackendError(String cacheName) {
    }

    @Override
    public void recordCreditSpent(String resourceKind) {
    }

    @Override
    public void recordResolution(ResolutionMethod method) {
    }

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
    }

    @Override
    public void recordItemFailure(PipelineStage stage) {
    }

    @Override
    public void recordPageSize(int size) {
    }
}
