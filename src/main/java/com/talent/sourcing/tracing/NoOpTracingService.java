package com.talent.sourcing.tracing;

import com.talent.sourcing.session.PipelineStage;

/**
 * Tracing disabled. Every stage shares one inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final StageSpan INERT = new StageSpan() {
        @Override
        public void recordCount(StageCounter counter, long value) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void fail(Throwable error, boolean rejected) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public StageSpan startStage(PipelineStage stage, String sessionId) {
        return INERT;
    }
}
