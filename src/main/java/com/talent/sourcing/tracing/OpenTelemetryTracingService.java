package com.talent.sourcing.tracing;

import com.talent.sourcing.session.PipelineStage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Locale;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 * Stage spans are named {@code sourcing.stage.<stage>} and carry the session id.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String SESSION_ID = "sourcing.session_id";
    static final String STAGE = "sourcing.stage";
    static final String REJECTED = "sourcing.rejected";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public StageSpan startStage(PipelineStage stage, String sessionId) {
        String stageName = stage.name().toLowerCase(Locale.ROOT);
        Span span = tracer.spanBuilder("sourcing.stage." + stageName)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(SESSION_ID, sessionId)
                .setAttribute(STAGE, stageName)
                .startSpan();
        return new OTelStageSpan(span);
    }

    private static class OTelStageSpan implements StageSpan {

        private final Span span;

        OTelStageSpan(Span span) {
            this.span = span;
        }

        @Override
        public void recordCount(StageCounter counter, long value) {
            span.setAttribute(counter.attributeKey(), value);
        }

        @Override
        public void succeed() {
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable error, boolean rejected) {
            span.recordException(error);
            span.setAttribute(REJECTED, rejected);
            span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
