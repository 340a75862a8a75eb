package com.entity.canonical.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates named checks. The aggregate takes the worst status of its checks;
 * its message names the first check that reported that status.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();

    /**
     * Adds a check, replacing any earlier check of the same name.
     */
    public void register(HealthCheck check) {
        Objects.requireNonNull(check, "check is required");
        checks.put(check.name(), check);
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> perCheck = new LinkedHashMap<>();
        HealthStatus.Status aggregate = HealthStatus.Status.UP;
        String message = "OK";

        for (String name : checks.keySet().stream().sorted().toList()) {
            HealthStatus result = run(checks.get(name));
            perCheck.put(name, Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));

            HealthStatus.Status worse = aggregate.worse(result.status());
            if (worse != aggregate) {
                aggregate = worse;
                message = name + ": " + result.message();
            }
        }
        return new HealthStatus(aggregate, message, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={} error={}", check.name(), e.getMessage());
            return HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
