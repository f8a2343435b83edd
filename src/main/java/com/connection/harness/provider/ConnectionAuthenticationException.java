package com.connection.harness.provider;

/**
 * Raised when the remote service rejects the connection's credentials.
 */
public class ConnectionAuthenticationException extends ConnectionException {

    public ConnectionAuthenticationException(String message) {
        super(message);
    }

    public ConnectionAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
