package com.entity.canonical.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC entries for one fit or resolve call.
 *
 * <p>Opening a context assigns a fresh correlation id. Closing it puts back
 * whatever the MDC held for those keys before, so contexts may nest.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.resolve("city")) {
 *     log.info("resolve.completed path={} candidates={}", path, count);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String ENTITY_TYPE = "entityType";
    public static final String OPERATION = "operation";

    private final String correlationId;
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext(String operation, String entityType) {
        this.correlationId = UUID.randomUUID().toString();
        with(CORRELATION_ID, correlationId);
        with(ENTITY_TYPE, entityType);
        with(OPERATION, operation);
    }

    public static LogContext resolve(String entityType) {
        return new LogContext("resolve", entityType);
    }

    public static LogContext fit(String entityType) {
        return new LogContext("fit", entityType);
    }

    public String correlationId() {
        return correlationId;
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
