package com.entity.canonical.health;

/**
 * One named check reported by {@link HealthCheckRegistry}.
 */
public interface HealthCheck {

    String name();

    /**
     * May throw; the registry reports a throwing check as DOWN.
     */
    HealthStatus check();
}
