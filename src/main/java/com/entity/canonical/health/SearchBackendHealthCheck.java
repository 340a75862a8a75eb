package com.entity.canonical.health;

import com.entity.canonical.api.EntityResolver;
import com.entity.canonical.api.EntityResolverRegistry;
import com.entity.canonical.lifecycle.IndexLifecycleManager;

/**
 * Checks the backend connection of every resolver that has connected so far.
 * DOWN when all of them are unavailable, DEGRADED when only some are.
 */
public class SearchBackendHealthCheck implements HealthCheck {

    private final EntityResolverRegistry registry;

    public SearchBackendHealthCheck(EntityResolverRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "searchBackend";
    }

    @Override
    public HealthStatus check() {
        HealthStatus status = HealthStatus.up();
        int connected = 0;
        int unavailable = 0;

        for (EntityResolver resolver : registry.getResolvers()) {
            IndexLifecycleManager lifecycle = resolver.getLifecycle();
            if (!lifecycle.isConnected()) {
                continue;
            }
            connected++;
            long startMs = System.currentTimeMillis();
            boolean available;
            try {
                available = lifecycle.backend().isAvailable();
            } catch (RuntimeException e) {
                available = false;
            }
            if (!available) {
                unavailable++;
            }
            status = status.withDetail(resolver.getEntityType(), available
                    ? "UP (" + (System.currentTimeMillis() - startMs) + "ms)"
                    : "DOWN");
        }

        if (connected == 0) {
            return HealthStatus.up("No backend connection opened yet");
        }
        if (unavailable == connected) {
            return HealthStatus.down("Search backend unavailable").withDetails(status.details());
        }
        if (unavailable > 0) {
            return HealthStatus.degraded(unavailable + " of " + connected + " backend connections unavailable")
                    .withDetails(status.details());
        }
        return status;
    }
}
