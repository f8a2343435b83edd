package com.connection.harness.event;

/**
 * Kinds of connection lifecycle events.
 */
public enum ConnectionEventType {
    CREATED,
    CLOSED,
    ERROR,
    HEALTH_CHECK
}
