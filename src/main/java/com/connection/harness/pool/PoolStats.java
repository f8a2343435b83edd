package com.connection.harness.pool;

import java.util.Map;

/**
 * Statistics for a {@link ConnectionPool}.
 *
 * @param liveConnections       number of connections currently pooled
 * @param connectionsByService  live connections per service type
 * @param totalCreated          cumulative connections created by the pool through providers
 * @param totalAdded            cumulative connections added from outside the pool
 * @param totalReused           cumulative get-or-create calls answered with a pooled connection
 * @param totalClosed           cumulative connections removed and closed
 * @param totalCreationFailures cumulative provider failures during get-or-create
 */
public record PoolStats(
        int liveConnections,
        Map<String, Integer> connectionsByService,
        long totalCreated,
        long totalAdded,
        long totalReused,
        long totalClosed,
        long totalCreationFailures
) {
    public PoolStats {
        connectionsByService = connectionsByService != null ? Map.copyOf(connectionsByService) : Map.of();
    }
}
