package com.connection.harness.event;

import com.connection.harness.core.model.ConnectionKey;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification about a connection lifecycle change.
 *
 * @param connectionId the connection id
 * @param serviceType  the service type of the connection
 * @param eventType    what happened
 * @param timestamp    when the event was produced
 * @param details      additional key-value details, never null
 */
public record ConnectionEvent(
        String connectionId,
        String serviceType,
        ConnectionEventType eventType,
        Instant timestamp,
        Map<String, Object> details
) {

    public static final String DETAIL_MESSAGE = "message";
    public static final String DETAIL_HEALTHY = "healthy";

    public ConnectionEvent {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(eventType, "eventType");
        timestamp = timestamp != null ? timestamp : Instant.now();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static ConnectionEvent of(ConnectionKey key, ConnectionEventType type, Map<String, Object> details) {
        return new ConnectionEvent(key.connectionId(), key.serviceType(), type, Instant.now(), details);
    }

    public static ConnectionEvent created(ConnectionKey key) {
        return of(key, ConnectionEventType.CREATED, Map.of());
    }

    public static ConnectionEvent closed(ConnectionKey key) {
        return of(key, ConnectionEventType.CLOSED, Map.of());
    }

    public static ConnectionEvent error(ConnectionKey key, String message) {
        return of(key, ConnectionEventType.ERROR,
                Map.of(DETAIL_MESSAGE, message != null ? message : "unknown error"));
    }

    public static ConnectionEvent healthCheck(ConnectionKey key, boolean healthy) {
        return of(key, ConnectionEventType.HEALTH_CHECK, Map.of(DETAIL_HEALTHY, healthy));
    }

    public ConnectionKey key() {
        return new ConnectionKey(serviceType, connectionId);
    }
}
