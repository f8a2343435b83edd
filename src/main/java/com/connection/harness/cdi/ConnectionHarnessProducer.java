package com.connection.harness.cdi;

import com.connection.harness.api.ConnectionHarness;
import com.connection.harness.api.ConnectionManager;
import com.connection.harness.config.HarnessConfig;
import com.connection.harness.config.HarnessConfigLoader;
import com.connection.harness.lock.LocalKeyedLock;
import com.connection.harness.lock.LockConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * CDI producer that wires the connection harness from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it produces the {@link HarnessConfig}, the {@link ConnectionManager} and the
 * {@link ConnectionHarness} facade. Providers are registered by the test code.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * connection-harness:
 *   config-path: config            # directory, YAML file or classpath resource
 *   lock:
 *     timeout-millis: 60000
 *   observers:
 *     logging: true
 *     metrics: true
 *     health: true
 * </pre>
 *
 * <p>A {@link MeterRegistry} bean, if the container has one, receives the connection event counters.</p>
 */
@ApplicationScoped
public class ConnectionHarnessProducer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHarnessProducer.class);

    // ── Configuration source ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-harness.config-path")
    Optional<String> configPath;

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-harness.lock.timeout-millis", defaultValue = "60000")
    long lockTimeoutMillis;

    // ── Observers ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-harness.observers.logging", defaultValue = "true")
    boolean loggingObserverEnabled;

    @Inject
    @ConfigProperty(name = "connection-harness.observers.metrics", defaultValue = "true")
    boolean metricsObserverEnabled;

    @Inject
    @ConfigProperty(name = "connection-harness.observers.health", defaultValue = "true")
    boolean healthObserverEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public HarnessConfig harnessConfig() {
        if (configPath == null || configPath.isEmpty()) {
            log.info("No connection-harness.config-path set, using empty configuration");
            return HarnessConfig.empty();
        }
        HarnessConfig config = new HarnessConfigLoader().load(configPath.get());
        log.info("Harness configuration loaded from {}: services={}", configPath.get(), config.serviceTypes());
        return config;
    }

    @Produces
    @ApplicationScoped
    public ConnectionManager connectionManager() {
        log.info("Producing ConnectionManager: lockTimeoutMillis={}", lockTimeoutMillis);
        return ConnectionManager.builder()
                .keyedLock(new LocalKeyedLock(new LockConfig(lockTimeoutMillis)))
                .build();
    }

    // records and builder-only classes cannot be proxied, so no normal scope here
    @Produces
    @Singleton
    public ConnectionHarness connectionHarness(ConnectionManager manager, HarnessConfig config) {
        ConnectionHarness.Builder builder = ConnectionHarness.builder()
                .manager(manager)
                .config(config)
                .loggingEnabled(loggingObserverEnabled)
                .metricsEnabled(metricsObserverEnabled)
                .healthEnabled(healthObserverEnabled);

        if (meterRegistries != null && meterRegistries.isResolvable()) {
            builder.meterRegistry(meterRegistries.get());
            log.info("Connection event metrics bound to container MeterRegistry");
        }

        ConnectionHarness harness = builder.build();
        log.info("Producing ConnectionHarness: logging={} metrics={} health={}",
                loggingObserverEnabled, metricsObserverEnabled, healthObserverEnabled);
        return harness;
    }

    public void closeHarness(@Disposes ConnectionHarness harness) {
        log.info("Closing ConnectionHarness");
        harness.close();
    }
}
