package com.connection.harness.lock;

import com.connection.harness.core.model.ConnectionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock backed by one fair {@link ReentrantLock} per connection key.
 *
 * <p>An entry counts the lock calls that are waiting for or holding it, and is dropped once
 * that count returns to zero, so keys that are no longer in use do not accumulate.</p>
 */
public class LocalKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalKeyedLock.class);

    private final ConcurrentHashMap<ConnectionKey, LockEntry> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalKeyedLock() {
        this(LockConfig.defaults());
    }

    public LocalKeyedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(ConnectionKey key) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for: " + key, e);
        }
        if (!acquired) {
            release(key);
            throw new LockAcquisitionException(
                    "Failed to acquire lock for '" + key + "' within " + config.timeoutMs() + "ms");
        }
        log.trace("Lock acquired: {}", key);
    }

    @Override
    public void unlock(ConnectionKey key) {
        LockEntry entry = locks.get(key);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            release(key);
            log.trace("Lock released: {}", key);
        }
    }

    /**
     * Checks if any thread currently holds the lock for the given key.
     */
    public boolean isLocked(ConnectionKey key) {
        LockEntry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    int trackedKeys() {
        return locks.size();
    }

    private void release(ConnectionKey key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int users;
    }
}
