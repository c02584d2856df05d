package com.talent.sourcing.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forStage(sessionId, "collection")) {
 *     log.info("stage.completed collected={} failed={}", collected, failed);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for a single pipeline stage.
     */
    public static LogContext forStage(String sessionId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("stage", stage);
        ctx.put("operation", "stage");
        return ctx;
    }

    /**
     * Creates a log context for a collection page.
     */
    public static LogContext forCollection(String sessionId, int startIndex, int count) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("stage", "collection");
        ctx.put("page", startIndex + "+" + count);
        ctx.put("operation", "collect");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
