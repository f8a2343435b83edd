package com.connection.harness.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of one harness component, or of the harness as a whole, with key-value details.
 *
 * <p>Besides the plain factories it knows the two rollups the harness reports:
 * {@link #forConnections(int, List)} for the connections tracked from events, and
 * {@link #aggregate(Map)} for a set of named check results.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public static final String DETAIL_TRACKED = "tracked";
    public static final String DETAIL_UNHEALTHY = "unhealthy";

    /**
     * Ordered from best to worst.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        message = message != null ? message : status.name();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    /**
     * Health of a set of tracked connections.
     *
     * <ul>
     *   <li>Nothing tracked, or nothing unhealthy: UP.</li>
     *   <li>Every tracked connection unhealthy: DOWN.</li>
     *   <li>Otherwise DEGRADED, naming how many are unhealthy.</li>
     * </ul>
     *
     * @param tracked   number of connections with a known health flag
     * @param unhealthy ids of the tracked connections flagged unhealthy
     */
    public static HealthStatus forConnections(int tracked, List<String> unhealthy) {
        if (tracked < unhealthy.size()) {
            throw new IllegalArgumentException(
                    "unhealthy count " + unhealthy.size() + " exceeds tracked count " + tracked);
        }
        if (tracked == 0) {
            return up("No connections tracked");
        }
        HealthStatus base;
        if (unhealthy.isEmpty()) {
            base = up();
        } else if (unhealthy.size() == tracked) {
            base = down("All tracked connections unhealthy");
        } else {
            base = degraded(unhealthy.size() + " of " + tracked + " connections unhealthy");
        }
        return base
                .withDetail(DETAIL_TRACKED, tracked)
                .withDetail(DETAIL_UNHEALTHY, List.copyOf(unhealthy));
    }

    /**
     * Rolls named results into one status. The worst status wins, and the first result with that
     * status names the message as {@code "name: message"}. Every result is kept as a detail
     * under its name, see {@link #asDetail()}.
     */
    public static HealthStatus aggregate(Map<String, HealthStatus> results) {
        if (results.isEmpty()) {
            return up("No health checks registered");
        }
        String worstName = null;
        HealthStatus worst = up();
        Map<String, Object> details = new LinkedHashMap<>();
        for (Map.Entry<String, HealthStatus> entry : results.entrySet()) {
            HealthStatus result = entry.getValue();
            if (result.status.compareTo(worst.status) > 0) {
                worst = result;
                worstName = entry.getKey();
            }
            details.put(entry.getKey(), result.asDetail());
        }
        String message = worstName == null ? "OK" : worstName + ": " + worst.message;
        return new HealthStatus(worst.status, message, details);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new HealthStatus(status, message, copy);
    }

    /**
     * This status as a plain map of {@code status}, {@code message} and {@code details},
     * for nesting inside an aggregate.
     */
    public Map<String, Object> asDetail() {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", status.name());
        detail.put("message", message);
        detail.put("details", details);
        return Collections.unmodifiableMap(detail);
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
