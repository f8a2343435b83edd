package com.connection.harness.pool;

import com.connection.harness.config.ConnectionSettings;
import com.connection.harness.core.model.Connection;
import com.connection.harness.core.model.ConnectionResult;
import com.connection.harness.provider.ConnectionProvider;
import com.connection.harness.provider.ConnectionTimeoutException;
import com.connection.harness.provider.ProviderRegistry;
import com.connection.harness.support.StubConnection;
import com.connection.harness.support.StubConnectionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DefaultConnectionPoolTest {

    private DefaultConnectionPool pool;
    private StubConnectionProvider provider;

    @BeforeEach
    void setUp() {
        pool = new DefaultConnectionPool();
        provider = new StubConnectionProvider();
        pool.registerProvider("svc", provider);
    }

    @Nested
    @DisplayName("Get or create")
    class GetOrCreate {

        @Test
        @DisplayName("Should create a connection on first request and reuse it after")
        void testCreateThenReuse() {
            ConnectionResult first = pool.getConnection("svc", "c1", null);
            ConnectionResult second = pool.getConnection("svc", "c1", null);

            assertEquals(ConnectionResult.Status.CREATED, first.status());
            assertEquals(ConnectionResult.Status.REUSED, second.status());
            assertSame(first.connection(), second.connection());
            assertEquals(1, provider.getCalls());
        }

        @Test
        @DisplayName("Should pass the settings to the provider unchanged")
        void testSettingsPassThrough() {
            ConnectionSettings settings = ConnectionSettings.of("c1", Map.of("port", 22));
            pool.getConnection("svc", "c1", settings);
            assertSame(settings, provider.getReceivedSettings().get(0));
        }

        @Test
        @DisplayName("Should report NOT_CONFIGURED when no provider is registered")
        void testNoProvider() {
            ConnectionResult result = pool.getConnection("other", "c1", null);
            assertTrue(result.isNotConfigured());
            assertTrue(pool.findConnection("other", "c1").isEmpty());
        }

        @Test
        @DisplayName("Should report FAILED and count the failure when the provider throws")
        void testProviderFailure() {
            pool.registerProvider("slow", new StubConnectionProvider()
                    .failWith(new ConnectionTimeoutException("timed out after 5s")));

            ConnectionResult result = pool.getConnection("slow", "c1", null);

            assertTrue(result.isFailed());
            assertEquals("timed out after 5s", result.errorMessage());
            assertEquals(1, pool.getStats().totalCreationFailures());
            assertEquals(0, pool.getStats().liveConnections());
        }

        @Test
        @DisplayName("Should report FAILED when the provider returns null")
        void testProviderReturnsNull() {
            pool.registerProvider("null", new StubConnectionProvider().returnNull());

            ConnectionResult result = pool.getConnection("null", "c1", null);

            assertTrue(result.isFailed());
            assertEquals(1, pool.getStats().totalCreationFailures());
        }

        @Test
        @DisplayName("Should stop creating connections once the provider is unregistered")
        void testUnregisterProvider() {
            assertSame(provider, pool.unregisterProvider("svc").orElseThrow());

            assertTrue(pool.getConnection("svc", "c1", null).isNotConfigured());
            assertTrue(pool.unregisterProvider("svc").isEmpty());
        }

        @Test
        @DisplayName("Should see providers added to and removed from a shared registry")
        void testSharedRegistry() {
            ProviderRegistry registry = new ProviderRegistry();
            DefaultConnectionPool shared = new DefaultConnectionPool(registry);

            registry.register("svc", new StubConnectionProvider());
            assertEquals(ConnectionResult.Status.CREATED, shared.getConnection("svc", "c1", null).status());

            registry.unregister("svc");
            assertTrue(shared.getConnection("svc", "c2", null).isNotConfigured());
        }

        @Test
        @DisplayName("Should keep one connection and close the duplicate when creations race")
        void testRaceClosesDuplicate() throws Exception {
            int threads = 4;
            CountDownLatch arrived = new CountDownLatch(threads);
            StubConnectionProvider racing = new StubConnectionProvider() {
                @Override
                public Connection createConnection(String connectionId) {
                    arrived.countDown();
                    try {
                        arrived.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.createConnection(connectionId);
                }
            };
            pool.registerProvider("race", racing);

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<ConnectionResult>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> pool.getConnection("race", "shared", null)));
                }
                Connection pooled = null;
                int created = 0;
                for (Future<ConnectionResult> future : futures) {
                    ConnectionResult result = future.get(10, TimeUnit.SECONDS);
                    if (result.isCreated()) {
                        created++;
                    }
                    pooled = result.connection();
                }
                assertEquals(1, created);
                assertSame(pooled, pool.findConnection("race", "shared").orElseThrow());
            } finally {
                executor.shutdownNow();
            }

            long closed = racing.getCreated().stream().filter(StubConnection::isClosed).count();
            assertEquals(threads - 1, closed);
            assertEquals(1, pool.getStats().liveConnections());
        }
    }

    @Nested
    @DisplayName("Add and find")
    class AddAndFind {

        @Test
        @DisplayName("Should store an added connection")
        void testAdd() {
            StubConnection connection = new StubConnection("c1");

            Optional<CloseOutcome> displaced = pool.addConnection("svc", "c1", connection);

            assertTrue(displaced.isEmpty());
            assertSame(connection, pool.findConnection("svc", "c1").orElseThrow());
            assertEquals(1, pool.getStats().totalAdded());
        }

        @Test
        @DisplayName("Should close the connection it replaces and report the outcome")
        void testReplace() {
            StubConnection first = new StubConnection("c1");
            StubConnection second = new StubConnection("c1");
            pool.addConnection("svc", "c1", first);

            CloseOutcome displaced = pool.addConnection("svc", "c1", second).orElseThrow();

            assertTrue(displaced.isSuccess());
            assertEquals("svc", displaced.key().serviceType());
            assertTrue(first.isClosed());
            assertFalse(second.isClosed());
            assertEquals(1, pool.getStats().totalClosed());
        }

        @Test
        @DisplayName("Should report a failed close of the replaced connection and still store the new one")
        void testReplaceCloseFailure() {
            StubConnection second = new StubConnection("c1");
            pool.addConnection("svc", "c1", new StubConnection("c1").failOnClose(new IllegalStateException("stuck")));

            CloseOutcome displaced = pool.addConnection("svc", "c1", second).orElseThrow();

            assertFalse(displaced.isSuccess());
            assertEquals("stuck", displaced.failureMessage());
            assertSame(second, pool.findConnection("svc", "c1").orElseThrow());
        }

        @Test
        @DisplayName("Should ignore re-adding the same instance")
        void testReAddSameInstance() {
            StubConnection connection = new StubConnection("c1");
            pool.addConnection("svc", "c1", connection);

            assertTrue(pool.addConnection("svc", "c1", connection).isEmpty());
            assertFalse(connection.isClosed());
            assertEquals(1, pool.getStats().totalAdded());
        }

        @Test
        @DisplayName("Should reject a null connection")
        void testRejectNull() {
            assertThrows(IllegalArgumentException.class, () -> pool.addConnection("svc", "c1", null));
        }

        @Test
        @DisplayName("Should group connections by service type then id")
        void testGetAllConnections() {
            StubConnection a = new StubConnection("a");
            StubConnection b = new StubConnection("b");
            StubConnection x = new StubConnection("x");
            pool.addConnection("svc", "b", b);
            pool.addConnection("svc", "a", a);
            pool.addConnection("db", "x", x);

            Map<String, Map<String, Connection>> all = pool.getAllConnections();

            assertEquals(List.of("db", "svc"), List.copyOf(all.keySet()));
            assertEquals(List.of("a", "b"), List.copyOf(all.get("svc").keySet()));
            assertSame(x, all.get("db").get("x"));
            assertThrows(UnsupportedOperationException.class, () -> all.remove("db"));
        }
    }

    @Nested
    @DisplayName("Close")
    class Close {

        @Test
        @DisplayName("Should remove and close a single connection")
        void testCloseConnection() {
            ConnectionResult created = pool.getConnection("svc", "c1", null);

            CloseOutcome outcome = pool.closeConnection("svc", "c1").orElseThrow();

            assertTrue(outcome.isSuccess());
            assertTrue(((StubConnection) created.connection()).isClosed());
            assertTrue(pool.findConnection("svc", "c1").isEmpty());
        }

        @Test
        @DisplayName("Should return empty when closing an unknown key")
        void testCloseUnknown() {
            assertTrue(pool.closeConnection("svc", "missing").isEmpty());
        }

        @Test
        @DisplayName("Should remove a connection whose close fails and report the failure")
        void testCloseFailure() {
            pool.addConnection("svc", "c1", new StubConnection("c1").failOnClose(new IllegalStateException("stuck")));

            CloseOutcome outcome = pool.closeConnection("svc", "c1").orElseThrow();

            assertFalse(outcome.isSuccess());
            assertEquals("stuck", outcome.failureMessage());
            assertTrue(pool.findConnection("svc", "c1").isEmpty());
        }

        @Test
        @DisplayName("Should close every connection, best effort")
        void testCloseAll() {
            pool.getConnection("svc", "a", null);
            pool.addConnection("svc", "b", new StubConnection("b").failOnClose(new IllegalStateException("stuck")));
            pool.getConnection("svc", "c", null);

            List<CloseOutcome> outcomes = pool.closeAllConnections();

            assertEquals(3, outcomes.size());
            assertEquals(1, outcomes.stream().filter(o -> !o.isSuccess()).count());
            assertTrue(pool.getAllConnections().isEmpty());
            assertEquals(3, pool.getStats().totalClosed());
        }

        @Test
        @DisplayName("Should close every connection when the pool is closed")
        void testAutoClose() {
            pool.getConnection("svc", "a", null);
            pool.close();
            assertEquals(0, pool.getStats().liveConnections());
        }
    }

    @Test
    @DisplayName("Should report statistics")
    void testStats() {
        pool.getConnection("svc", "a", null);
        pool.getConnection("svc", "a", null);
        pool.addConnection("db", "x", new StubConnection("x"));

        PoolStats stats = pool.getStats();

        assertEquals(2, stats.liveConnections());
        assertEquals(Map.of("db", 1, "svc", 1), stats.connectionsByService());
        assertEquals(1, stats.totalCreated());
        assertEquals(1, stats.totalAdded());
        assertEquals(1, stats.totalReused());
        assertEquals(0, stats.totalClosed());
    }

    @Test
    @DisplayName("Should let the pool use a provider through the interface")
    void testProviderInterface() {
        ConnectionProvider lambda = id -> new StubConnection(id);
        pool.registerProvider("lambda", lambda);
        assertTrue(pool.getConnection("lambda", "c1", null).isCreated());
    }
}
