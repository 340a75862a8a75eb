package com.entity.canonical.tracing;

/**
 * A traced fit or fuzzy search. Closing the span ends it:
 *
 * <pre>
 * try (Span span = tracing.startSpan(TracingService.FIT, Map.of("entityType", "city"))) {
 *     ...
 *     span.attribute("documents", count).succeeded();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    Span attribute(String key, String value);

    Span attribute(String key, long value);

    void succeeded();

    /**
     * Marks the span as failed and attaches the error.
     */
    void failed(Throwable error);

    @Override
    void close();
}
