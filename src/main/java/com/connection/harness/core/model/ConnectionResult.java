package com.connection.harness.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of asking for a connection. Distinguishes a service type with no provider
 * from a provider that failed, and keeps the failure for the caller.
 *
 * @param key          the requested connection
 * @param status       what happened
 * @param connection   the connection, present only for {@link Status#CREATED} and {@link Status#REUSED}
 * @param errorMessage failure description for {@link Status#NOT_CONFIGURED} and {@link Status#FAILED}
 * @param cause        the provider's exception for {@link Status#FAILED}, may be null
 */
public record ConnectionResult(
        ConnectionKey key,
        Status status,
        Connection connection,
        String errorMessage,
        Throwable cause
) {

    public enum Status {
        /** A new connection was created and pooled. */
        CREATED,
        /** An already pooled connection was returned. */
        REUSED,
        /** No provider is registered for the service type. */
        NOT_CONFIGURED,
        /** The provider failed to create the connection. */
        FAILED
    }

    public ConnectionResult {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(status, "status");
        if ((status == Status.CREATED || status == Status.REUSED) && connection == null) {
            throw new IllegalArgumentException(status + " result requires a connection");
        }
    }

    public static ConnectionResult created(ConnectionKey key, Connection connection) {
        return new ConnectionResult(key, Status.CREATED, connection, null, null);
    }

    public static ConnectionResult reused(ConnectionKey key, Connection connection) {
        return new ConnectionResult(key, Status.REUSED, connection, null, null);
    }

    public static ConnectionResult notConfigured(ConnectionKey key) {
        return new ConnectionResult(key, Status.NOT_CONFIGURED, null,
                "No provider registered for service type: " + key.serviceType(), null);
    }

    public static ConnectionResult failed(ConnectionKey key, String errorMessage, Throwable cause) {
        return new ConnectionResult(key, Status.FAILED, null, errorMessage, cause);
    }

    public boolean isSuccess() {
        return connection != null;
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }

    public boolean isNotConfigured() {
        return status == Status.NOT_CONFIGURED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public Optional<Connection> getConnection() {
        return Optional.ofNullable(connection);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }
}
