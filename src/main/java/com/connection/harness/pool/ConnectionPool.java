package com.connection.harness.pool;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.Connection;
import com.connection.harness.core.model.ConnectionResult;
import com.connection.harness.provider.ConnectionProvider;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns live connections keyed by service type and connection id.
 * Holds at most one connection per key.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Registers the provider the pool uses to create connections of a service type on demand.
     */
    void registerProvider(String serviceType, ConnectionProvider provider);

    /**
     * Removes the provider of a service type. Pooled connections of that type stay pooled.
     *
     * @return the removed provider, if one was registered
     */
    Optional<ConnectionProvider> unregisterProvider(String serviceType);

    /**
     * Returns the pooled connection for the key, or creates one through the registered provider.
     *
     * @param settings passed unchanged to the provider, may be null
     * @return {@code REUSED}, {@code CREATED}, {@code NOT_CONFIGURED} or {@code FAILED}
     */
    ConnectionResult getConnection(String serviceType, String connectionId, ConnectionSettings settings);

    /**
     * Adds a live connection. A connection already pooled under the same key is closed and removed.
     *
     * @return how closing the displaced connection went, if there was one
     */
    Optional<CloseOutcome> addConnection(String serviceType, String connectionId, Connection connection);

    Optional<Connection> findConnection(String serviceType, String connectionId);

    /**
     * Removes and closes one connection.
     *
     * @return the outcome, or empty if no connection was pooled under the key
     */
    Optional<CloseOutcome> closeConnection(String serviceType, String connectionId);

    /**
     * Removes and closes every pooled connection, continuing past failures.
     *
     * @return one outcome per connection that was pooled
     */
    List<CloseOutcome> closeAllConnections();

    /**
     * Returns a snapshot of pooled connections grouped by service type, then connection id.
     */
    Map<String, Map<String, Connection>> getAllConnections();

    PoolStats getStats();

    /**
     * Closes every pooled connection.
     */
    @Override
    default void close() {
        closeAllConnections();
    }
}
