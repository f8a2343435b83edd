package com.connection.harness.pool;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.Connection;
import com.connection.harness.core.model.ConnectionKey;
import com.connection.harness.core.model.ConnectionResult;
import com.connection.harness.provider.ConnectionProvider;
import com.connection.harness.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe connection pool backed by a {@link ConcurrentHashMap} keyed by {@link ConnectionKey}.
 *
 * <p>Get-or-create does not hold a lock while the provider runs. When two callers race to
 * create the same key, the first connection stored wins and the loser's connection is
 * closed; callers that need one creation per key serialise on the key themselves.</p>
 */
public class DefaultConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionPool.class);

    private final ProviderRegistry providers;
    private final ConcurrentHashMap<ConnectionKey, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong totalCreated = new AtomicLong(0);
    private final AtomicLong totalAdded = new AtomicLong(0);
    private final AtomicLong totalReused = new AtomicLong(0);
    private final AtomicLong totalClosed = new AtomicLong(0);
    private final AtomicLong totalCreationFailures = new AtomicLong(0);

    public DefaultConnectionPool() {
        this(new ProviderRegistry());
    }

    /**
     * Creates a pool that looks providers up in the given registry, so providers registered
     * or removed through it are seen by get-or-create immediately.
     */
    public DefaultConnectionPool(ProviderRegistry providers) {
        this.providers = Objects.requireNonNull(providers, "providers");
    }

    @Override
    public void registerProvider(String serviceType, ConnectionProvider provider) {
        providers.register(serviceType, provider);
        log.debug("Pool provider registered for {}", serviceType);
    }

    @Override
    public Optional<ConnectionProvider> unregisterProvider(String serviceType) {
        Optional<ConnectionProvider> removed = providers.unregister(serviceType);
        removed.ifPresent(p -> log.debug("Pool provider unregistered for {}", serviceType));
        return removed;
    }

    @Override
    public ConnectionResult getConnection(String serviceType, String connectionId, ConnectionSettings settings) {
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);

        Connection existing = connections.get(key);
        if (existing != null) {
            totalReused.incrementAndGet();
            log.debug("Reusing pooled connection {}", key);
            return ConnectionResult.reused(key, existing);
        }

        Optional<ConnectionProvider> provider = providers.get(serviceType);
        if (provider.isEmpty()) {
            log.warn("No provider registered in pool for service type: {}", serviceType);
            return ConnectionResult.notConfigured(key);
        }

        Connection created;
        try {
            created = provider.get().createConnection(connectionId, settings);
        } catch (RuntimeException e) {
            totalCreationFailures.incrementAndGet();
            String message = describe(e);
            log.error("Pool failed to create connection {}: {}", key, message, e);
            return ConnectionResult.failed(key, message, e);
        }
        if (created == null) {
            totalCreationFailures.incrementAndGet();
            log.warn("Provider for {} returned no connection for {}", serviceType, connectionId);
            return ConnectionResult.failed(key, "Provider returned no connection", null);
        }

        Connection winner = connections.putIfAbsent(key, created);
        if (winner != null) {
            log.debug("Connection {} was created concurrently, discarding duplicate", key);
            closeQuietly(key, created);
            totalReused.incrementAndGet();
            return ConnectionResult.reused(key, winner);
        }

        totalCreated.incrementAndGet();
        log.debug("Pooled new connection {} (live={})", key, connections.size());
        return ConnectionResult.created(key, created);
    }

    @Override
    public Optional<CloseOutcome> addConnection(String serviceType, String connectionId, Connection connection) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);
        Connection previous = connections.put(key, connection);
        if (previous == connection) {
            return Optional.empty();
        }
        totalAdded.incrementAndGet();
        if (previous != null) {
            log.info("Replacing pooled connection {}, closing the previous one", key);
            return Optional.of(close(key, previous));
        }
        log.debug("Connection added {} (live={})", key, connections.size());
        return Optional.empty();
    }

    @Override
    public Optional<Connection> findConnection(String serviceType, String connectionId) {
        return Optional.ofNullable(connections.get(ConnectionKey.of(serviceType, connectionId)));
    }

    @Override
    public Optional<CloseOutcome> closeConnection(String serviceType, String connectionId) {
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);
        Connection removed = connections.remove(key);
        if (removed == null) {
            log.debug("No pooled connection {} to close", key);
            return Optional.empty();
        }
        return Optional.of(close(key, removed));
    }

    @Override
    public List<CloseOutcome> closeAllConnections() {
        List<CloseOutcome> outcomes = new ArrayList<>();
        for (ConnectionKey key : new ArrayList<>(connections.keySet())) {
            Connection removed = connections.remove(key);
            if (removed != null) {
                outcomes.add(close(key, removed));
            }
        }
        if (!outcomes.isEmpty()) {
            log.info("Closed {} pooled connection(s)", outcomes.size());
        }
        return outcomes;
    }

    @Override
    public Map<String, Map<String, Connection>> getAllConnections() {
        Map<String, Map<String, Connection>> grouped = new TreeMap<>();
        connections.forEach((key, connection) ->
                grouped.computeIfAbsent(key.serviceType(), s -> new TreeMap<>())
                        .put(key.connectionId(), connection));
        grouped.replaceAll((serviceType, byId) -> Collections.unmodifiableMap(byId));
        return Collections.unmodifiableMap(grouped);
    }

    @Override
    public PoolStats getStats() {
        Map<String, Integer> byService = new TreeMap<>();
        for (ConnectionKey key : connections.keySet()) {
            byService.merge(key.serviceType(), 1, Integer::sum);
        }
        return new PoolStats(
                connections.size(),
                byService,
                totalCreated.get(),
                totalAdded.get(),
                totalReused.get(),
                totalClosed.get(),
                totalCreationFailures.get()
        );
    }

    private CloseOutcome close(ConnectionKey key, Connection connection) {
        totalClosed.incrementAndGet();
        try {
            connection.close();
            log.debug("Closed pooled connection {}", key);
            return CloseOutcome.closed(key);
        } catch (Exception e) {
            log.warn("Error closing connection {}: {}", key, e.getMessage());
            return CloseOutcome.failed(key, e);
        }
    }

    private void closeQuietly(ConnectionKey key, Connection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing connection {}: {}", key, e.getMessage());
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
