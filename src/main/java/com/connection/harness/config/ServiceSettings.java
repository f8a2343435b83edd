package com.connection.harness.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one service type and its configured connections.
 *
 * @param serviceType the service type tag
 * @param enabled     whether any connection of this service may be created
 * @param connections configured connections in declaration order
 */
public record ServiceSettings(String serviceType, boolean enabled, List<ConnectionSettings> connections) {

    public ServiceSettings {
        Objects.requireNonNull(serviceType, "serviceType");
        connections = connections != null ? List.copyOf(connections) : List.of();
    }

    public static ServiceSettings disabled(String serviceType) {
        return new ServiceSettings(serviceType, false, List.of());
    }

    /**
     * Returns the connections that may be created: none if the service is disabled,
     * otherwise every connection not individually disabled.
     */
    public List<ConnectionSettings> enabledConnections() {
        if (!enabled) {
            return List.of();
        }
        return connections.stream()
                .filter(ConnectionSettings::enabled)
                .toList();
    }

    public Optional<ConnectionSettings> find(String connectionId) {
        return connections.stream()
                .filter(c -> c.name().equals(connectionId))
                .findFirst();
    }
}
