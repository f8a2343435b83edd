package com.connection.harness.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named health checks combined into one status with {@link HealthStatus#aggregate(Map)}.
 * Checks run in name order. A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();

    /**
     * Registers a check, replacing any check with the same name.
     */
    public void register(HealthCheck check) {
        if (check == null) {
            return;
        }
        checks.put(check.getName(), check);
    }

    public boolean unregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthStatus check(String name) {
        HealthCheck check = checks.get(name);
        if (check == null) {
            return HealthStatus.down("Unknown health check: " + name);
        }
        return run(check);
    }

    public HealthStatus checkAll() {
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        checks.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(check -> results.put(check.getName(), run(check)));
        return HealthStatus.aggregate(results);
    }

    public int size() {
        return checks.size();
    }

    private HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check {} failed: {}", check.getName(), e.getMessage());
            return HealthStatus.down("Health check failed: " + e.getMessage());
        }
    }
}
