package com.connection.harness.health;

import com.connection.harness.core.model.ConnectionKey;
import com.connection.harness.event.HealthCheckObserver;

import java.util.List;
import java.util.Map;

/**
 * Summarises the per-connection health tracked by a {@link HealthCheckObserver}.
 * DOWN when every tracked connection is unhealthy, DEGRADED when only some are.
 */
public class ConnectionHealthCheck implements HealthCheck {

    private final HealthCheckObserver observer;

    public ConnectionHealthCheck(HealthCheckObserver observer) {
        this.observer = observer;
    }

    @Override
    public String getName() {
        return "connections";
    }

    @Override
    public HealthStatus check() {
        Map<ConnectionKey, Boolean> health = observer.getHealthStatus();
        List<String> unhealthy = health.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(e -> e.getKey().toString())
                .sorted()
                .toList();
        return HealthStatus.forConnections(health.size(), unhealthy);
    }
}
