package com.talent.sourcing.cdi;

import com.talent.sourcing.metrics.MicrometerMetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.tracing.NoOpTracingService;
import com.talent.sourcing.tracing.OpenTelemetryTracingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourcingProducer Tests")
class SourcingProducerTest {

    @Test
    @DisplayName("Should produce no-op observability by default")
    void disabledByDefault() {
        SourcingProducer producer = new SourcingProducer();

        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        assertInstanceOf(NoOpTracingService.class, producer.tracingService());
    }

    @Test
    @DisplayName("Should produce Micrometer metrics when enabled")
    void metricsEnabled() {
        SourcingProducer producer = new SourcingProducer();
        producer.metricsEnabled = true;

        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("Should produce OpenTelemetry tracing when enabled")
    void tracingEnabled() {
        SourcingProducer producer = new SourcingProducer();
        producer.tracingEnabled = true;

        assertInstanceOf(OpenTelemetryTracingService.class, producer.tracingService());
    }
}
