package com.connection.harness.core.model;

/**
 * Handle to a live session with a remote service.
 * The content is provider-specific; the harness only relies on the lifecycle methods below.
 */
public interface Connection extends AutoCloseable {

    /**
     * Establishes the session with the remote service.
     */
    void connect();

    /**
     * Checks if the session is established.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Checks if the remote service answers on this session.
     *
     * @return true if healthy
     */
    default boolean healthCheck() {
        return isConnected();
    }

    /**
     * Closes the session and releases its resources.
     */
    @Override
    void close() throws Exception;
}
