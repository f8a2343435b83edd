package com.connection.harness.api;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.Connection;
import com.connection.harness.core.model.ConnectionKey;
import com.connection.harness.core.model.ConnectionResult;
import com.connection.harness.event.ConnectionEvent;
import com.connection.harness.event.ConnectionObserver;
import com.connection.harness.event.ObserverNotificationException;
import com.connection.harness.lock.KeyedLock;
import com.connection.harness.lock.LocalKeyedLock;
import com.connection.harness.lock.LockAcquisitionException;
import com.connection.harness.logging.LogContext;
import com.connection.harness.pool.CloseOutcome;
import com.connection.harness.pool.ConnectionPool;
import com.connection.harness.pool.DefaultConnectionPool;
import com.connection.harness.provider.ConnectionProvider;
import com.connection.harness.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for creating, reusing and closing connections to remote services.
 *
 * <p>The manager keeps a {@link ProviderRegistry} (one provider per service type), a
 * {@link ConnectionPool} that owns live connections, and an ordered list of
 * {@link ConnectionObserver}s. It is the only component that emits connection events:
 * every connection it creates produces exactly one {@code CREATED} event, delivered to
 * the observers in the order they were attached.</p>
 *
 * <p>Locking is split in two. A registry lock guards provider registration and the
 * observer list and is never held while a provider or observer runs. Work on a single
 * connection (create, get, close) is serialised per {@link ConnectionKey} through a
 * {@link KeyedLock}, so a slow provider only delays callers of the same key.</p>
 *
 * <p>Provider failures never reach the caller as exceptions; they are returned as a
 * {@link ConnectionResult} with status {@code FAILED} and the provider's message.</p>
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConnectionPool pool;
    private final ProviderRegistry providers;
    private final KeyedLock keyLock;
    private final ReentrantLock registryLock = new ReentrantLock();
    private final List<ConnectionObserver> observers = new ArrayList<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public ConnectionManager() {
        this(builder());
    }

    private ConnectionManager(Builder builder) {
        this.providers = builder.providers != null ? builder.providers : new ProviderRegistry();
        this.keyLock = builder.keyLock != null ? builder.keyLock : new LocalKeyedLock();
        if (builder.pool != null) {
            this.pool = builder.pool;
            // a custom pool keeps its own providers, seed it with the ones known so far
            this.providers.getAll().forEach(this.pool::registerProvider);
        } else {
            this.pool = new DefaultConnectionPool(this.providers);
        }
        log.debug("Connection manager components initialized (providers={})", this.providers.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Lifecycle ==========

    /**
     * Marks the manager ready. Calling it again has no effect.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.warn("Connection manager already initialized");
            return;
        }
        log.info("Connection manager initialized");
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Closes every pooled connection, then clears the ready flag.
     * Providers and observers stay registered so {@link #initialize()} makes the manager usable again.
     */
    public void shutdown() {
        log.info("Starting connection manager shutdown");
        closeAllConnections();
        initialized.set(false);
        log.info("Connection manager shutdown completed");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Returns an async view of this manager. The caller owns the returned instance and must close it.
     */
    public AsyncConnectionManager async() {
        return new AsyncConnectionManagerImpl(this);
    }

    // ========== Observers ==========

    /**
     * Appends an observer. The same observer attached twice is notified twice.
     */
    public void attachObserver(ConnectionObserver observer) {
        Objects.requireNonNull(observer, "observer");
        registryLock.lock();
        try {
            observers.add(observer);
            log.debug("Observer attached: {} (total={})", observer, observers.size());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Removes the first attachment of an observer.
     *
     * @return true if the observer was attached
     */
    public boolean detachObserver(ConnectionObserver observer) {
        registryLock.lock();
        try {
            boolean removed = observers.remove(observer);
            log.debug("Observer detached: {} removed={} (total={})", observer, removed, observers.size());
            return removed;
        } finally {
            registryLock.unlock();
        }
    }

    public List<ConnectionObserver> getObservers() {
        registryLock.lock();
        try {
            return List.copyOf(observers);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Delivers an event to every attached observer in attachment order.
     * An observer that throws does not stop delivery to the others.
     *
     * @throws ObserverNotificationException after delivery if any observer threw
     */
    public void notifyObservers(ConnectionEvent event) {
        Objects.requireNonNull(event, "event");
        List<ConnectionObserver> snapshot = getObservers();
        log.debug("Notifying {} observers of event: {}", snapshot.size(), event);

        List<RuntimeException> failures = new ArrayList<>();
        for (ConnectionObserver observer : snapshot) {
            try {
                observer.onConnectionEvent(event);
            } catch (RuntimeException e) {
                log.error("Error notifying observer {} of {} event for {}:{}: {}",
                        observer, event.eventType(), event.serviceType(), event.connectionId(), e.getMessage(), e);
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            ObserverNotificationException exception = new ObserverNotificationException(event, failures.size());
            failures.forEach(exception::addSuppressed);
            throw exception;
        }
    }

    // ========== Providers ==========

    /**
     * Registers the provider for a service type, replacing any previous one,
     * and makes it available to the pool for get-or-create.
     */
    public void registerProvider(String serviceType, ConnectionProvider provider) {
        log.info("Registering provider for service type: {}", serviceType);
        registryLock.lock();
        try {
            providers.register(serviceType, provider);
            pool.registerProvider(serviceType, provider);
        } finally {
            registryLock.unlock();
        }
        log.debug("Provider details: {}", provider);
    }

    /**
     * Removes the provider of a service type from the manager and the pool. Connections it
     * already created stay pooled until closed.
     *
     * @return the removed provider, if one was registered
     */
    public Optional<ConnectionProvider> unregisterProvider(String serviceType) {
        registryLock.lock();
        try {
            Optional<ConnectionProvider> removed = providers.unregister(serviceType);
            pool.unregisterProvider(serviceType);
            removed.ifPresent(p -> log.info("Unregistered provider for service type: {}", serviceType));
            return removed;
        } finally {
            registryLock.unlock();
        }
    }

    public Optional<ConnectionProvider> getProvider(String serviceType) {
        return providers.get(serviceType);
    }

    public ProviderRegistry getProviderRegistry() {
        return providers;
    }

    // ========== Connections ==========

    /**
     * Creates a connection through the provider registered for the service type and pools it.
     *
     * <ul>
     *   <li>No provider: {@code NOT_CONFIGURED}, no event.</li>
     *   <li>Provider throws or returns null: {@code FAILED}, no event, nothing pooled.</li>
     *   <li>Success: the connection is pooled, one {@code CREATED} event is emitted. A connection
     *       previously pooled under the same key is closed first and reported with a {@code CLOSED} event,
     *       or {@code ERROR} if closing it failed.</li>
     * </ul>
     */
    public ConnectionResult createConnection(String serviceType, String connectionId) {
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);
        try (LogContext ctx = LogContext.forConnection(key, "create")) {
            log.info("Creating connection for service type: {}", serviceType);

            Optional<ConnectionProvider> provider = providers.get(serviceType);
            if (provider.isEmpty()) {
                log.warn("No provider found for service type: {}", serviceType);
                return ConnectionResult.notConfigured(key);
            }

            if (!lock(key)) {
                return ConnectionResult.failed(key, "Timed out waiting for connection lock", null);
            }
            try {
                Connection connection;
                try {
                    connection = provider.get().createConnection(connectionId);
                } catch (RuntimeException e) {
                    String message = describe(e);
                    log.error("Error creating connection {}:{}: {}", serviceType, connectionId, message, e);
                    return ConnectionResult.failed(key, message, e);
                }
                if (connection == null) {
                    log.warn("Provider for {} returned no connection for {}", serviceType, connectionId);
                    return ConnectionResult.failed(key, "Provider returned no connection", null);
                }

                pool.addConnection(serviceType, connectionId, connection).ifPresent(this::publishClose);
                log.info("Successfully created connection for {}", serviceType);
                publish(ConnectionEvent.created(key));
                return ConnectionResult.created(key, connection);
            } finally {
                keyLock.unlock(key);
            }
        }
    }

    /**
     * Returns the pooled connection for the key or lets the pool create one,
     * passing the settings through unchanged. Emits a {@code CREATED} event when the pool created one.
     */
    public ConnectionResult getConnection(String serviceType, String connectionId, ConnectionSettings settings) {
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);
        try (LogContext ctx = LogContext.forConnection(key, "get")) {
            log.debug("Retrieving connection {} for {}", connectionId, serviceType);

            if (!lock(key)) {
                return ConnectionResult.failed(key, "Timed out waiting for connection lock", null);
            }
            try {
                ConnectionResult result;
                try {
                    result = pool.getConnection(serviceType, connectionId, settings);
                } catch (RuntimeException e) {
                    String message = describe(e);
                    log.error("Error retrieving connection {}: {}", key, message, e);
                    return ConnectionResult.failed(key, message, e);
                }
                if (result.isCreated()) {
                    publish(ConnectionEvent.created(key));
                }
                return result;
            } finally {
                keyLock.unlock(key);
            }
        }
    }

    /**
     * Closes one pooled connection. Emits {@code CLOSED}, or {@code ERROR} if the connection's close failed.
     *
     * @return true if a connection was pooled under the key
     */
    public boolean closeConnection(String serviceType, String connectionId) {
        ConnectionKey key = ConnectionKey.of(serviceType, connectionId);
        try (LogContext ctx = LogContext.forConnection(key, "close")) {
            log.info("Closing connection for {}", serviceType);

            if (!lock(key)) {
                return false;
            }
            try {
                Optional<CloseOutcome> outcome = pool.closeConnection(serviceType, connectionId);
                outcome.ifPresent(this::publishClose);
                return outcome.isPresent();
            } finally {
                keyLock.unlock(key);
            }
        }
    }

    /**
     * Closes every pooled connection, best effort, emitting one event per connection.
     *
     * @return number of connections that were pooled
     */
    public int closeAllConnections() {
        List<CloseOutcome> outcomes = pool.closeAllConnections();
        outcomes.forEach(this::publishClose);
        return outcomes.size();
    }

    public Optional<Connection> findConnection(String serviceType, String connectionId) {
        return pool.findConnection(serviceType, connectionId);
    }

    public ConnectionPool getPool() {
        return pool;
    }

    // ========== Internal ==========

    private boolean lock(ConnectionKey key) {
        try {
            keyLock.lock(key);
            return true;
        } catch (LockAcquisitionException e) {
            log.error("Could not lock connection {}: {}", key, e.getMessage());
            return false;
        }
    }

    private void publishClose(CloseOutcome outcome) {
        if (outcome.isSuccess()) {
            publish(ConnectionEvent.closed(outcome.key()));
        } else {
            publish(ConnectionEvent.error(outcome.key(), outcome.failureMessage()));
        }
    }

    private void publish(ConnectionEvent event) {
        try {
            notifyObservers(event);
        } catch (ObserverNotificationException e) {
            log.warn(e.getMessage());
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public static class Builder {
        private ConnectionPool pool;
        private ProviderRegistry providers;
        private KeyedLock keyLock;

        /**
         * Sets the pool. Defaults to a {@link DefaultConnectionPool} that shares the manager's provider registry.
         */
        public Builder pool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Sets the provider registry. The default pool looks providers up in it directly. A custom
         * pool is given the providers already in it on build.
         */
        public Builder providerRegistry(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        /**
         * Sets the per-connection lock. Defaults to a {@link LocalKeyedLock}.
         */
        public Builder keyedLock(KeyedLock keyLock) {
            this.keyLock = keyLock;
            return this;
        }

        public ConnectionManager build() {
            return new ConnectionManager(this);
        }
    }
}
