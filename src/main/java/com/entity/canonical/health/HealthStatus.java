package com.entity.canonical.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a health check. Details are rendered as-is by the REST health endpoint.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }

        /**
         * Whether resolutions can still be served, possibly for fewer entity types.
         */
        public boolean isServing() {
            return this != DOWN;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status is required");
        message = message != null ? message : "";
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of());
    }

    public static HealthStatus up() {
        return of(Status.UP, "OK");
    }

    public static HealthStatus up(String message) {
        return of(Status.UP, message);
    }

    public static HealthStatus degraded(String message) {
        return of(Status.DEGRADED, message);
    }

    public static HealthStatus down(String message) {
        return of(Status.DOWN, message);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    public HealthStatus withDetails(Map<String, ?> more) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(more);
        return new HealthStatus(status, message, merged);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
