package com.connection.harness.pool;

import com.connection.harness.core.model.ConnectionKey;

/**
 * Result of closing one pooled connection. The connection is removed from the pool
 * whether or not its close succeeded.
 *
 * @param key     the closed connection
 * @param failure the exception raised by the connection's close, or null
 */
public record CloseOutcome(ConnectionKey key, Exception failure) {

    public static CloseOutcome closed(ConnectionKey key) {
        return new CloseOutcome(key, null);
    }

    public static CloseOutcome failed(ConnectionKey key, Exception failure) {
        return new CloseOutcome(key, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String failureMessage() {
        if (failure == null) {
            return null;
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
