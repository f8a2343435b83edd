package com.connection.harness.lock;

/**
 * Configuration for {@link LocalKeyedLock}.
 *
 * @param timeoutMs maximum time to wait for a per-connection lock
 */
public record LockConfig(long timeoutMs) {

    public static final long DEFAULT_TIMEOUT_MS = 60_000;

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 60s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(DEFAULT_TIMEOUT_MS);
    }
}
