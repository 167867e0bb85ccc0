package com.fleet.moderation.tracing;

/**
 * A unit of work in a trace. Closing the span ends it:
 *
 * <pre>
 * try (Span span = tracing.startSpan("fleet.dispatch", targetId)) {
 *     span.setAttribute(SpanAttributes.SCOPE_COUNT, scopes.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the exception and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
