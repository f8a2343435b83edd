package com.connection.harness.provider;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.config.HarnessConfig;
import com.connection.harness.config.ServiceSettings;
import com.connection.harness.core.model.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for providers driven by {@link ServiceSettings}.
 *
 * <p>Subclasses only build the connection object in {@link #openConnection}; this class
 * resolves the connection's settings, rejects unknown or disabled connection ids and
 * connects the new connection before handing it out.</p>
 */
public abstract class AbstractConnectionProvider implements ConnectionProvider {
    private static final Logger log = LoggerFactory.getLogger(AbstractConnectionProvider.class);

    private final String serviceType;
    private volatile ServiceSettings settings;

    /**
     * Creates a provider with no configured connections. It only creates connections from
     * settings passed to {@link #createConnection(String, ConnectionSettings)} until configured.
     */
    protected AbstractConnectionProvider(String serviceType) {
        this.serviceType = Objects.requireNonNull(serviceType, "serviceType");
        this.settings = new ServiceSettings(serviceType, true, List.of());
    }

    protected AbstractConnectionProvider(ServiceSettings settings) {
        this.serviceType = settings.serviceType();
        this.settings = settings;
    }

    /**
     * Picks this provider's service settings out of the harness configuration.
     * A missing section leaves the provider with no enabled connections.
     */
    public void configure(HarnessConfig config) {
        ServiceSettings found = config.service(serviceType).orElse(null);
        if (found == null) {
            log.warn("No configuration found for service type {}, available services: {}",
                    serviceType, config.serviceTypes());
            configure(ServiceSettings.disabled(serviceType));
            return;
        }
        configure(found);
    }

    public void configure(ServiceSettings settings) {
        if (!serviceType.equals(settings.serviceType())) {
            throw new IllegalArgumentException("Settings for '" + settings.serviceType()
                    + "' cannot configure provider of '" + serviceType + "'");
        }
        this.settings = settings;
        log.info("{} configured: enabledConnections={}", getClass().getSimpleName(), getEnabledConnections());
    }

    /**
     * Builds the connection object for the given settings. The returned connection is not yet connected.
     */
    protected abstract Connection openConnection(String connectionId, ConnectionSettings settings);

    @Override
    public Connection createConnection(String connectionId) {
        ConnectionSettings connectionSettings = settings.enabledConnections().stream()
                .filter(c -> c.name().equals(connectionId))
                .findFirst()
                .orElseThrow(() -> new ConnectionException(
                        "No enabled configuration for connection '" + connectionId
                                + "' of service '" + serviceType + "'"));
        return createConnection(connectionId, connectionSettings);
    }

    /**
     * Opens and connects a connection from explicit settings.
     *
     * @throws ConnectionException if the service or the connection is disabled
     */
    @Override
    public Connection createConnection(String connectionId, ConnectionSettings connectionSettings) {
        if (connectionSettings == null) {
            return createConnection(connectionId);
        }
        if (!settings.enabled()) {
            throw new ConnectionException("Service '" + serviceType + "' is disabled, refusing connection '"
                    + connectionId + "'");
        }
        if (!connectionSettings.enabled()) {
            throw new ConnectionException("Connection '" + connectionId + "' of service '" + serviceType
                    + "' is disabled");
        }
        log.debug("Creating {} connection for ID: {}", serviceType, connectionId);
        Connection connection = openConnection(connectionId, connectionSettings);
        try {
            connection.connect();
        } catch (RuntimeException e) {
            closeQuietly(connectionId, connection);
            throw e;
        }
        log.info("{} connection created for ID: {}", serviceType, connectionId);
        return connection;
    }

    /**
     * Creates every enabled connection. Connections that fail are logged and left out.
     *
     * @return created connections keyed by connection id, in configuration order
     */
    public Map<String, Connection> createConnections() {
        Map<String, Connection> created = new LinkedHashMap<>();
        for (String connectionId : getEnabledConnections()) {
            try {
                created.put(connectionId, createConnection(connectionId));
            } catch (RuntimeException e) {
                log.error("Error creating {} connection {}: {}", serviceType, connectionId, e.getMessage(), e);
            }
        }
        return created;
    }

    public List<String> getEnabledConnections() {
        return settings.enabledConnections().stream()
                .map(ConnectionSettings::name)
                .toList();
    }

    public String getServiceType() {
        return serviceType;
    }

    public ServiceSettings getSettings() {
        return settings;
    }

    private void closeQuietly(String connectionId, Connection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing {} connection {} after failed connect: {}",
                    serviceType, connectionId, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{serviceType='" + serviceType + "'}";
    }
}
