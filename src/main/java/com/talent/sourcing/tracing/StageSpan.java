package com.talent.sourcing.tracing;

/**
 * Span covering one invocation of a pipeline stage.
 * Exactly one of {@link #succeed()} or {@link #fail(Throwable, boolean)} is called before close.
 */
public interface StageSpan extends AutoCloseable {

    void recordCount(StageCounter counter, long value);

    void succeed();

    /**
     * @param rejected true when the stage refused the caller's input rather than breaking
     */
    void fail(Throwable error, boolean rejected);

    /** Ends the span. Does not throw. */
    @Override
    void close();
}
