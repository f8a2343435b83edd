package com.connection.harness.core.model;

/**
 * Identifies a pooled connection by service type and caller-supplied connection id.
 *
 * @param serviceType  the service type tag, e.g. {@code remote_command}
 * @param connectionId the connection id within that service type
 */
public record ConnectionKey(String serviceType, String connectionId) {

    public ConnectionKey {
        if (serviceType == null || serviceType.isBlank()) {
            throw new IllegalArgumentException("serviceType must not be blank");
        }
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId must not be blank");
        }
    }

    public static ConnectionKey of(String serviceType, String connectionId) {
        return new ConnectionKey(serviceType, connectionId);
    }

    @Override
    public String toString() {
        return serviceType + ":" + connectionId;
    }
}
