package com.entity.canonical.tracing;

import java.util.Map;

/**
 * Used when no tracer is configured.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operation, Map<String, String> attributes) {
        return NoOpSpan.INSTANCE;
    }

    private enum NoOpSpan implements Span {
        INSTANCE;

        @Override
        public Span attribute(String key, String value) {
            return this;
        }

        @Override
        public Span attribute(String key, long value) {
            return this;
        }

        @Override
        public void succeeded() {
        }

        @Override
        public void failed(Throwable error) {
        }

        @Override
        public void close() {
        }
    }
}
