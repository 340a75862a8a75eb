package com.entity.canonical.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Reports spans to OpenTelemetry. Attribute keys are namespaced under
 * {@value #ATTRIBUTE_PREFIX}. Needs the optional {@code opentelemetry-api}
 * dependency at runtime.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String ATTRIBUTE_PREFIX = "canonical.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operation, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operation);
        attributes.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        return new OTelSpan(builder.startSpan());
    }

    private static final class OTelSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        private OTelSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public Span attribute(String key, String value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
            return this;
        }

        @Override
        public Span attribute(String key, long value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
            return this;
        }

        @Override
        public void succeeded() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable error) {
            delegate.recordException(error);
            delegate.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
