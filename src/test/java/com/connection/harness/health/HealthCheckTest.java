package com.connection.harness.health;

import com.connection.harness.core.model.ConnectionKey;
import com.connection.harness.event.ConnectionEvent;
import com.connection.harness.event.HealthCheckObserver;
import com.connection.harness.pool.DefaultConnectionPool;
import com.connection.harness.provider.ConnectionException;
import com.connection.harness.support.StubConnectionProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckTest {

    private static HealthCheck fixed(String name, HealthStatus status) {
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return status;
            }
        };
    }

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Should create statuses with messages")
        void testFactories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
        }

        @Test
        @DisplayName("Should add details without mutating the original")
        void testWithDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("live", 3);

            assertTrue(base.details().isEmpty());
            assertEquals(3, detailed.details().get("live"));
        }

        @Test
        @DisplayName("Should roll up tracked connections into UP, DEGRADED or DOWN")
        void testForConnections() {
            HealthStatus none = HealthStatus.forConnections(0, List.of());
            assertTrue(none.isUp());
            assertEquals("No connections tracked", none.message());

            assertTrue(HealthStatus.forConnections(2, List.of()).isUp());

            HealthStatus degraded = HealthStatus.forConnections(3, List.of("svc:b"));
            assertTrue(degraded.isDegraded());
            assertEquals("1 of 3 connections unhealthy", degraded.message());
            assertEquals(3, degraded.details().get(HealthStatus.DETAIL_TRACKED));

            assertTrue(HealthStatus.forConnections(2, List.of("svc:a", "svc:b")).isDown());
        }

        @Test
        @DisplayName("Should reject more unhealthy connections than tracked ones")
        void testForConnectionsInconsistent() {
            assertThrows(IllegalArgumentException.class, () -> HealthStatus.forConnections(1, List.of("a", "b")));
        }

        @Test
        @DisplayName("Should keep the first of equally bad results when aggregating")
        void testAggregate() {
            Map<String, HealthStatus> results = new LinkedHashMap<>();
            results.put("pool", HealthStatus.up());
            results.put("first", HealthStatus.degraded("slow"));
            results.put("second", HealthStatus.degraded("slower"));

            HealthStatus aggregate = HealthStatus.aggregate(results);

            assertTrue(aggregate.isDegraded());
            assertEquals("first: slow", aggregate.message());
            assertEquals(HealthStatus.degraded("slower").asDetail(), aggregate.details().get("second"));
        }

        @Test
        @DisplayName("Should report OK when every aggregated result is UP")
        void testAggregateAllUp() {
            HealthStatus aggregate = HealthStatus.aggregate(Map.of("pool", HealthStatus.up("idle")));

            assertTrue(aggregate.isUp());
            assertEquals("OK", aggregate.message());
            assertEquals(Map.of("status", "UP", "message", "idle", "details", Map.of()),
                    aggregate.details().get("pool"));
        }

        @Test
        @DisplayName("Should default the message to the status name")
        void testDefaultMessage() {
            assertEquals("DOWN", new HealthStatus(HealthStatus.Status.DOWN, null, null).message());
            assertThrows(IllegalArgumentException.class, () -> new HealthStatus(null, "x", Map.of()));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Should report UP when no checks are registered")
        void testEmpty() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Should report the worst status and name its check")
        void testWorstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            registry.register(fixed("c", HealthStatus.down("gone")));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("c: gone", status.message());
            assertEquals(List.of("a", "b", "c"), List.copyOf(status.details().keySet()));
        }

        @Test
        @DisplayName("Should count a throwing check as DOWN")
        void testThrowingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("check crashed");
                }
            });

            assertTrue(registry.checkAll().isDown());
            assertTrue(registry.check("broken").message().contains("check crashed"));
        }

        @Test
        @DisplayName("Should replace, unregister and look up checks by name")
        void testRegistration() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.down("x")));
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(null);

            assertEquals(1, registry.size());
            assertTrue(registry.check("a").isUp());
            assertTrue(registry.check("missing").isDown());
            assertTrue(registry.unregister("a"));
            assertFalse(registry.unregister("a"));
        }
    }

    @Nested
    @DisplayName("ConnectionPoolHealthCheck")
    class PoolCheckTests {

        @Test
        @DisplayName("Should report pool statistics as details")
        void testUp() {
            DefaultConnectionPool pool = new DefaultConnectionPool();
            pool.registerProvider("svc", new StubConnectionProvider());
            pool.getConnection("svc", "c1", null);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isUp());
            assertEquals(1, status.details().get("liveConnections"));
            assertEquals(1L, status.details().get("totalCreated"));
        }

        @Test
        @DisplayName("Should degrade when failures outnumber creations")
        void testDegraded() {
            DefaultConnectionPool pool = new DefaultConnectionPool();
            pool.registerProvider("svc", new StubConnectionProvider().failWith(new ConnectionException("refused")));
            pool.getConnection("svc", "c1", null);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isDegraded());
            assertEquals(1L, status.details().get("totalCreationFailures"));
        }
    }

    @Nested
    @DisplayName("ConnectionHealthCheck")
    class ConnectionCheckTests {

        private final HealthCheckObserver observer = new HealthCheckObserver();
        private final ConnectionHealthCheck check = new ConnectionHealthCheck(observer);

        @Test
        @DisplayName("Should be UP with nothing tracked")
        void testNothingTracked() {
            assertTrue(check.check().isUp());
        }

        @Test
        @DisplayName("Should be DEGRADED when some connections are unhealthy")
        void testDegraded() {
            observer.onConnectionEvent(ConnectionEvent.created(ConnectionKey.of("svc", "a")));
            observer.onConnectionEvent(ConnectionEvent.healthCheck(ConnectionKey.of("svc", "b"), false));

            HealthStatus status = check.check();

            assertTrue(status.isDegraded());
            assertEquals(List.of("svc:b"), status.details().get("unhealthy"));
        }

        @Test
        @DisplayName("Should be DOWN when every connection is unhealthy")
        void testDown() {
            observer.onConnectionEvent(ConnectionEvent.error(ConnectionKey.of("svc", "a"), "reset"));

            HealthStatus status = check.check();

            assertTrue(status.isDown());
            assertEquals(Map.of("tracked", 1, "unhealthy", List.of("svc:a")), status.details());
        }
    }
}
