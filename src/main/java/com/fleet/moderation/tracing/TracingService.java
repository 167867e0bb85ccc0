package com.fleet.moderation.tracing;

/**
 * Tracing seam. The default {@link NoOpTracingService} does nothing, so the library
 * works without any tracing backend.
 */
public interface TracingService {

    Span startSpan(String operationName);

    /**
     * Starts a span about one moderation target.
     */
    default Span startSpan(String operationName, long targetId) {
        Span span = startSpan(operationName);
        span.setAttribute(SpanAttributes.TARGET_ID, targetId);
        return span;
    }
}
