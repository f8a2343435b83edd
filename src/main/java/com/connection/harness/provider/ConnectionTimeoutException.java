package com.connection.harness.provider;

/**
 * Raised when a connection attempt times out.
 */
public class ConnectionTimeoutException extends ConnectionException {

    public ConnectionTimeoutException(String message) {
        super(message);
    }

    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
