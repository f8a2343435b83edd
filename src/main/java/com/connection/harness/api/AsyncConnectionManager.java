package com.connection.harness.api;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.ConnectionResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async view of a {@link ConnectionManager}.
 * All methods return {@link CompletableFuture} and run the blocking work on a background executor.
 */
public interface AsyncConnectionManager extends AutoCloseable {

    CompletableFuture<ConnectionResult> createConnectionAsync(String serviceType, String connectionId);

    CompletableFuture<ConnectionResult> getConnectionAsync(String serviceType, String connectionId,
                                                           ConnectionSettings settings);

    /**
     * Creates several connections of one service type in parallel.
     * Connections with different ids do not wait for each other.
     */
    CompletableFuture<List<ConnectionResult>> createConnectionsAsync(String serviceType, List<String> connectionIds);

    CompletableFuture<Boolean> closeConnectionAsync(String serviceType, String connectionId);

    CompletableFuture<Integer> closeAllConnectionsAsync();

    CompletableFuture<Void> shutdownAsync();

    /**
     * Stops the background executor. Does not shut the underlying manager down.
     */
    @Override
    void close();
}
