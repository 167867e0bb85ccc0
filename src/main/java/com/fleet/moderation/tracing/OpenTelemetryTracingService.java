package com.fleet.moderation.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link TracingService} backed by the OpenTelemetry API.
 * Spans are emitted under the {@value #INSTRUMENTATION_NAME} instrumentation scope.
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_NAME = "com.fleet.moderation";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Creates a service using the tracer of the given OpenTelemetry instance.
     */
    public static OpenTelemetryTracingService create(OpenTelemetry openTelemetry) {
        return new OpenTelemetryTracingService(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName) {
        return new Adapter(tracer.spanBuilder(operationName).startSpan());
    }

    private static final class Adapter implements Span {
        private final io.opentelemetry.api.trace.Span delegate;

        private Adapter(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
