package com.talent.sourcing.tracing;

import com.talent.sourcing.session.PipelineStage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Stage span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (StageSpan span = noOp.startStage(PipelineStage.COLLECTION, "search_1")) {
                    span.recordCount(StageCounter.CREDITS, 42L);
                    span.fail(new RuntimeException("test"), false);
                    span.succeed();
                }
            });
        }

        @Test
        @DisplayName("Should share one span across stages")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startStage(PipelineStage.DISCOVERY, "a"), noOp.startStage(PipelineStage.EVALUATION, "b"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class, RETURNS_SELF);
            otelSpan = mock(Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should name the span after the stage and tag the session")
        void createSpan() {
            StageSpan span = service.startStage(PipelineStage.PREVIEW, "search_1");

            assertNotNull(span);
            verify(tracer).spanBuilder("sourcing.stage.preview");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute("sourcing.session_id", "search_1");
            verify(builder).setAttribute("sourcing.stage", "preview");
        }

        @Test
        @DisplayName("Should record stage counts under their attribute keys")
        void counts() {
            StageSpan span = service.startStage(PipelineStage.COLLECTION, "search_1");

            span.recordCount(StageCounter.PROCESSED, 10L);
            span.recordCount(StageCounter.CREDITS, 7L);

            verify(otelSpan).setAttribute("sourcing.items.processed", 10L);
            verify(otelSpan).setAttribute("sourcing.credits.spent", 7L);
        }

        @Test
        @DisplayName("Should record the exception and mark a rejected stage")
        void failure() {
            StageSpan span = service.startStage(PipelineStage.COLLECTION, "search_1");
            RuntimeException error = new IllegalArgumentException("bad page");

            span.fail(error, true);

            verify(otelSpan).recordException(error);
            verify(otelSpan).setAttribute("sourcing.rejected", true);
            verify(otelSpan).setStatus(StatusCode.ERROR, "bad page");
        }

        @Test
        @DisplayName("Should end span on close")
        void endOnClose() {
            try (StageSpan span = service.startStage(PipelineStage.EVALUATION, "search_1")) {
                span.succeed();
            }
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}
