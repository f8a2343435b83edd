package com.connection.harness.health;

import com.connection.harness.pool.ConnectionPool;
import com.connection.harness.pool.PoolStats;

/**
 * Reports connection pool statistics. DEGRADED once provider failures outnumber
 * successful creations; the pool itself is always reachable.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private final ConnectionPool pool;

    public ConnectionPoolHealthCheck(ConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        PoolStats stats = pool.getStats();
        long created = stats.totalCreated() + stats.totalAdded();

        HealthStatus base;
        if (stats.totalCreationFailures() > 0 && stats.totalCreationFailures() > created) {
            base = HealthStatus.degraded("Connection creation failing: "
                    + stats.totalCreationFailures() + " failure(s), " + created + " created");
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("liveConnections", stats.liveConnections())
                .withDetail("connectionsByService", stats.connectionsByService())
                .withDetail("totalCreated", created)
                .withDetail("totalReused", stats.totalReused())
                .withDetail("totalClosed", stats.totalClosed())
                .withDetail("totalCreationFailures", stats.totalCreationFailures());
    }
}
