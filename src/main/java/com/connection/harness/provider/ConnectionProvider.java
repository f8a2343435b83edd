package com.connection.harness.provider;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.Connection;

/**
 * Factory for live connections of one service type (command execution, database,
 * messaging protocol, ...). The harness treats implementations as black boxes: any retry,
 * backoff or health probing lives inside the provider.
 */
public interface ConnectionProvider {

    /**
     * Creates a new connection for the given id using the provider's own configuration.
     *
     * @param connectionId the connection id
     * @return the new connection
     * @throws ConnectionException if the connection cannot be created
     */
    Connection createConnection(String connectionId);

    /**
     * Creates a new connection for the given id using caller-supplied settings.
     * Defaults to {@link #createConnection(String)}, ignoring the settings.
     *
     * @param connectionId the connection id
     * @param settings     settings passed through by the caller, may be null
     * @return the new connection
     * @throws ConnectionException if the connection cannot be created
     */
    default Connection createConnection(String connectionId, ConnectionSettings settings) {
        return createConnection(connectionId);
    }
}
