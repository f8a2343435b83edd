package com.connection.harness.api;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.ConnectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool-based implementation of {@link AsyncConnectionManager}.
 * Uses a cached pool of daemon threads so a hung provider never keeps the JVM alive.
 */
public class AsyncConnectionManagerImpl implements AsyncConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(AsyncConnectionManagerImpl.class);

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ConnectionManager manager;
    private final ExecutorService executor;

    public AsyncConnectionManagerImpl(ConnectionManager manager) {
        this(manager, Executors.newCachedThreadPool(daemonThreadFactory()));
    }

    public AsyncConnectionManagerImpl(ConnectionManager manager, ExecutorService executor) {
        this.manager = manager;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ConnectionResult> createConnectionAsync(String serviceType, String connectionId) {
        return CompletableFuture.supplyAsync(
                () -> manager.createConnection(serviceType, connectionId),
                executor
        );
    }

    @Override
    public CompletableFuture<ConnectionResult> getConnectionAsync(String serviceType, String connectionId,
                                                                  ConnectionSettings settings) {
        return CompletableFuture.supplyAsync(
                () -> manager.getConnection(serviceType, connectionId, settings),
                executor
        );
    }

    @Override
    public CompletableFuture<List<ConnectionResult>> createConnectionsAsync(String serviceType,
                                                                            List<String> connectionIds) {
        List<CompletableFuture<ConnectionResult>> futures = connectionIds.stream()
                .map(id -> createConnectionAsync(serviceType, id))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<Boolean> closeConnectionAsync(String serviceType, String connectionId) {
        return CompletableFuture.supplyAsync(
                () -> manager.closeConnection(serviceType, connectionId),
                executor
        );
    }

    @Override
    public CompletableFuture<Integer> closeAllConnectionsAsync() {
        return CompletableFuture.supplyAsync(manager::closeAllConnections, executor);
    }

    @Override
    public CompletableFuture<Void> shutdownAsync() {
        return CompletableFuture.runAsync(manager::shutdown, executor);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Async connection tasks still running after 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreadFactory() {
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable,
                    "connection-harness-" + poolId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
