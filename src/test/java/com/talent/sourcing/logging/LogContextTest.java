package com.talent.sourcing.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set sessionId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("search_1")) {
            assertEquals("search_1", MDC.get("sessionId"));
            assertEquals("run", MDC.get("operation"));
        }
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("forStage should set sessionId, stage and operation in MDC")
    void forStageSetsMDC() {
        try (LogContext ctx = LogContext.forStage("search_1", "preview")) {
            assertEquals("preview", MDC.get("stage"));
            assertEquals("stage", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forCollection should describe the page in MDC")
    void forCollectionSetsMDC() {
        try (LogContext ctx = LogContext.forCollection("search_1", 100, 50)) {
            assertEquals("100+50", MDC.get("page"));
            assertEquals("collect", MDC.get("operation"));
        }
        assertNull(MDC.get("page"));
    }

    @Test
    @DisplayName("with should add keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forRun("search_1").with("candidateId", "c42")) {
            assertEquals("c42", MDC.get("candidateId"));
        }
        assertNull(MDC.get("candidateId"));
    }

    @Test
    @DisplayName("Closing an inner context should leave unrelated outer keys alone")
    void nestedContexts() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forStage("search_1", "collection")) {
            assertEquals("r-1", MDC.get("requestId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return distinct values")
    void correlationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
