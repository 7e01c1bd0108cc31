package com.claim.dates.tracing;

/**
 * Trace span around one case analysis. Ends on {@link #close()}; a span closed without
 * {@link #succeed()} or {@link #fail(Throwable)} is left without a status.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Marks the analysis as completed, from the pipeline or from the result cache.
     */
    void succeed();

    /**
     * Records the exception that aborted the analysis and marks the span as failed.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
