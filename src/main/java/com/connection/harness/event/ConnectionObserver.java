package com.connection.harness.event;

/**
 * Listener for connection lifecycle events. Implementations can react to
 * connections being created, closed or failing, e.g. by logging or counting them.
 */
public interface ConnectionObserver {

    /**
     * Called for every event the connection manager emits.
     *
     * @param event the event, never null
     */
    void onConnectionEvent(ConnectionEvent event);
}
