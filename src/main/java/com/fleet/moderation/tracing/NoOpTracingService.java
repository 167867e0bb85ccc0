package com.fleet.moderation.tracing;

/**
 * {@link TracingService} that records nothing. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return NoOpSpan.INSTANCE;
    }

    private enum NoOpSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
