package com.connection.harness.event;

import com.connection.harness.core.model.ConnectionKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the last known health of each connection from the events it sees.
 * {@code CREATED} marks a connection healthy and {@code ERROR} marks it unhealthy. {@code CLOSED}
 * stops tracking it, a closed connection is gone, not broken.
 * {@code HEALTH_CHECK} events carry the flag in their {@code healthy} detail.
 */
public class HealthCheckObserver implements ConnectionObserver {

    private final Map<ConnectionKey, Boolean> healthStatus = new ConcurrentHashMap<>();

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        ConnectionKey key = event.key();
        switch (event.eventType()) {
            case CREATED -> healthStatus.put(key, true);
            case CLOSED -> healthStatus.remove(key);
            case ERROR -> healthStatus.put(key, false);
            case HEALTH_CHECK -> healthStatus.put(key,
                    Boolean.TRUE.equals(event.details().get(ConnectionEvent.DETAIL_HEALTHY)));
        }
    }

    /**
     * Returns a snapshot of health flags per connection.
     */
    public Map<ConnectionKey, Boolean> getHealthStatus() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(healthStatus));
    }

    public boolean isHealthy(ConnectionKey key) {
        return Boolean.TRUE.equals(healthStatus.get(key));
    }
}
