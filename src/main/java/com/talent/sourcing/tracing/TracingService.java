package com.talent.sourcing.tracing;

import com.talent.sourcing.session.PipelineStage;

/**
 * Opens a span per stage invocation of a sourcing session.
 * Implementations: {@link NoOpTracingService} (default), {@link OpenTelemetryTracingService}.
 */
public interface TracingService {

    StageSpan startStage(PipelineStage stage, String sessionId);
}
