package com.connection.harness.lock;

import com.connection.harness.core.model.ConnectionKey;

/**
 * Per-connection lock used to serialise create, get and close operations on the same
 * {@link ConnectionKey} while leaving other keys free to proceed.
 */
public interface KeyedLock {

    /**
     * Acquires the lock for the given key.
     *
     * @param key the connection key
     * @throws LockAcquisitionException if the lock cannot be acquired
     */
    void lock(ConnectionKey key);

    /**
     * Releases the lock for the given key. Does nothing if the current thread does not hold it.
     *
     * @param key the connection key
     */
    void unlock(ConnectionKey key);
}
