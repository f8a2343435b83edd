package com.connection.harness.api;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.config.HarnessConfig;
import com.connection.harness.config.ServiceSettings;
import com.connection.harness.core.model.ConnectionKey;
import com.connection.harness.core.model.ConnectionResult;
import com.connection.harness.event.ConnectionEvent;
import com.connection.harness.event.ConnectionEventType;
import com.connection.harness.event.ConnectionObserver;
import com.connection.harness.event.HealthCheckObserver;
import com.connection.harness.event.LoggingObserver;
import com.connection.harness.event.MetricsObserver;
import com.connection.harness.health.ConnectionHealthCheck;
import com.connection.harness.health.ConnectionPoolHealthCheck;
import com.connection.harness.health.HealthCheckRegistry;
import com.connection.harness.health.HealthStatus;
import com.connection.harness.logging.LogContext;
import com.connection.harness.provider.AbstractConnectionProvider;
import com.connection.harness.provider.ConnectionProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facade over a {@link ConnectionManager} for test steps and hooks.
 *
 * <p>Initialises itself on first use: initialises the manager, attaches the built-in logging,
 * metrics and health observers, and registers the harness health checks. Providers
 * registered through the facade are configured from the harness configuration when it has a
 * section for their service type.</p>
 *
 * <pre>
 * ConnectionHarness harness = ConnectionHarness.builder()
 *         .config(new HarnessConfigLoader().loadDirectory(Path.of("config")))
 *         .build();
 * harness.registerProvider("remote_command", new RemoteCommandProvider());
 * ConnectionResult result = harness.createConnection("remote_command", "build-host");
 * </pre>
 */
public class ConnectionHarness implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHarness.class);

    static final String DEFAULT_CONNECTION_ID = "default";

    private final ConnectionManager manager;
    private final HarnessConfig config;
    private final List<ConnectionObserver> builtInObservers = new ArrayList<>();
    private final MetricsObserver metricsObserver;
    private final HealthCheckObserver healthObserver;
    private final HealthCheckRegistry healthChecks = new HealthCheckRegistry();
    private boolean initialized;

    private ConnectionHarness(Builder builder) {
        this.manager = builder.manager != null ? builder.manager : new ConnectionManager();
        this.config = builder.config != null ? builder.config : HarnessConfig.empty();
        this.metricsObserver = builder.metricsEnabled
                ? new MetricsObserver(builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry())
                : null;
        this.healthObserver = builder.healthEnabled ? new HealthCheckObserver() : null;

        if (builder.loggingEnabled) {
            builtInObservers.add(new LoggingObserver());
        }
        if (metricsObserver != null) {
            builtInObservers.add(metricsObserver);
        }
        if (healthObserver != null) {
            builtInObservers.add(healthObserver);
        }

        healthChecks.register(new ConnectionPoolHealthCheck(manager.getPool()));
        if (healthObserver != null) {
            healthChecks.register(new ConnectionHealthCheck(healthObserver));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Lifecycle ==========

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        manager.initialize();
        builtInObservers.forEach(manager::attachObserver);
        initialized = true;
        log.info("Connection harness initialized: observers={} configuredServices={}",
                builtInObservers.size(), config.serviceTypes());
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    /**
     * Shuts the manager down and detaches the built-in observers.
     */
    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        manager.shutdown();
        builtInObservers.forEach(manager::detachObserver);
        initialized = false;
        log.info("Connection harness shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    // ========== Providers ==========

    /**
     * Registers a provider. An {@link AbstractConnectionProvider} is first configured from the
     * harness configuration if it has a section for the service type.
     */
    public void registerProvider(String serviceType, ConnectionProvider provider) {
        initialize();
        if (provider instanceof AbstractConnectionProvider configurable) {
            config.service(serviceType).ifPresent(configurable::configure);
        }
        manager.registerProvider(serviceType, provider);
    }

    public Optional<ConnectionProvider> getProvider(String serviceType) {
        initialize();
        return manager.getProvider(serviceType);
    }

    public Map<String, ConnectionProvider> getAllProviders() {
        initialize();
        return manager.getProviderRegistry().getAll();
    }

    // ========== Connections ==========

    public ConnectionResult createConnection(String serviceType, String connectionId) {
        initialize();
        return manager.createConnection(serviceType, connectionId);
    }

    /**
     * Creates the service's default connection: the first enabled connection of a configured
     * provider, or {@code "default"} when the provider has no configuration.
     */
    public ConnectionResult createConnection(String serviceType) {
        initialize();
        String connectionId = manager.getProvider(serviceType)
                .filter(AbstractConnectionProvider.class::isInstance)
                .map(AbstractConnectionProvider.class::cast)
                .flatMap(p -> p.getEnabledConnections().stream().findFirst())
                .orElse(DEFAULT_CONNECTION_ID);
        return manager.createConnection(serviceType, connectionId);
    }

    /**
     * Creates every connection enabled in the configuration for a service type.
     *
     * @return results keyed by connection id, in configuration order
     */
    public Map<String, ConnectionResult> createConnections(String serviceType) {
        initialize();
        Map<String, ConnectionResult> results = new LinkedHashMap<>();
        try (LogContext ctx = LogContext.forService(serviceType, "createAll")) {
            List<ConnectionSettings> connections = config.service(serviceType)
                    .map(ServiceSettings::enabledConnections)
                    .orElse(List.of());
            log.debug("Creating {} configured {} connection(s)", connections.size(), serviceType);
            for (ConnectionSettings connection : connections) {
                results.put(connection.name(), manager.createConnection(serviceType, connection.name()));
            }
            long created = results.values().stream().filter(ConnectionResult::isSuccess).count();
            log.info("Created {} of {} configured {} connection(s)", created, connections.size(), serviceType);
        }
        return results;
    }

    public ConnectionResult getConnection(String serviceType, String connectionId, ConnectionSettings settings) {
        initialize();
        return manager.getConnection(serviceType, connectionId, settings);
    }

    /**
     * Gets or creates a connection using its settings from the harness configuration, if any.
     * A connection the configuration declares but disables is refused with {@code FAILED}.
     */
    public ConnectionResult getConnection(String serviceType, String connectionId) {
        initialize();
        Optional<ServiceSettings> service = config.service(serviceType);
        Optional<ConnectionSettings> enabled = service.flatMap(s -> s.enabledConnections().stream()
                .filter(c -> c.name().equals(connectionId))
                .findFirst());
        if (enabled.isEmpty() && service.flatMap(s -> s.find(connectionId)).isPresent()) {
            log.warn("Connection {}:{} is disabled in configuration", serviceType, connectionId);
            return ConnectionResult.failed(ConnectionKey.of(serviceType, connectionId),
                    "Connection '" + connectionId + "' of service '" + serviceType + "' is disabled", null);
        }
        return getConnection(serviceType, connectionId, enabled.orElse(null));
    }

    public boolean closeConnection(String serviceType, String connectionId) {
        initialize();
        return manager.closeConnection(serviceType, connectionId);
    }

    public int closeAllConnections() {
        initialize();
        return manager.closeAllConnections();
    }

    // ========== Observability ==========

    /**
     * Publishes a caller-made event, e.g. the result of a health check run by a test step.
     */
    public void notifyConnectionEvent(String serviceType, String connectionId, ConnectionEventType eventType,
                                      Map<String, Object> details) {
        initialize();
        ConnectionEvent event = new ConnectionEvent(connectionId, serviceType, eventType, Instant.now(), details);
        manager.notifyObservers(event);
    }

    /**
     * Returns the last known health per connection, or an empty map when health tracking is disabled.
     */
    public Map<ConnectionKey, Boolean> getConnectionHealth() {
        initialize();
        return healthObserver != null ? healthObserver.getHealthStatus() : Map.of();
    }

    /**
     * Returns event counts per connection id, or an empty map when metrics are disabled.
     */
    public Map<String, Map<ConnectionEventType, Long>> getConnectionMetrics() {
        initialize();
        return metricsObserver != null ? metricsObserver.getMetrics() : Map.of();
    }

    public HealthStatus healthCheck() {
        return healthChecks.checkAll();
    }

    public HealthCheckRegistry getHealthChecks() {
        return healthChecks;
    }

    public ConnectionManager getManager() {
        return manager;
    }

    public HarnessConfig getConfig() {
        return config;
    }

    public static class Builder {
        private ConnectionManager manager;
        private HarnessConfig config;
        private MeterRegistry meterRegistry;
        private boolean loggingEnabled = true;
        private boolean metricsEnabled = true;
        private boolean healthEnabled = true;

        public Builder manager(ConnectionManager manager) {
            this.manager = manager;
            return this;
        }

        public Builder config(HarnessConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the registry for connection event counters. Defaults to a {@link SimpleMeterRegistry}.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder loggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public ConnectionHarness build() {
            return new ConnectionHarness(this);
        }
    }
}
