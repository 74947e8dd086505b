package com.directory.pool.health;

import com.directory.pool.connection.DirectoryConnection;
import com.directory.pool.metrics.NoOpPoolMetrics;
import com.directory.pool.pool.DirectoryConnectionPool;
import com.directory.pool.pool.FakeDirectoryConnection;
import com.directory.pool.pool.PoolConfig;
import com.directory.pool.pool.PoolStats;
import com.directory.pool.pool.SlotConnectionPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private FakeDirectoryConnection.Factory factory;
    private List<Runnable> scheduled;

    @BeforeEach
    void setUp() {
        factory = new FakeDirectoryConnection.Factory();
        scheduled = new ArrayList<>();
    }

    private SlotConnectionPool pool(int maxSize) {
        PoolConfig config = PoolConfig.builder().name("health").initialSize(0).maxSize(maxSize).build();
        return new SlotConnectionPool(config, factory, new NoOpPoolMetrics(), scheduled::add);
    }

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should set status and message")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("busy").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
            assertEquals("gone", HealthStatus.down("gone").message());
        }

        @Test
        @DisplayName("withDetail() should keep earlier details and stay immutable")
        void withDetail() {
            HealthStatus status = HealthStatus.up()
                    .withDetail("capacity", 10)
                    .withDetail("busy", 2);

            assertEquals(2, status.details().size());
            assertEquals(10, status.details().get("capacity"));
            assertThrows(UnsupportedOperationException.class,
                    () -> status.details().put("another", "value"));
        }

        @Test
        @DisplayName("worse() should pick the more severe status")
        void worse() {
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.Status.UP.worse(HealthStatus.Status.DEGRADED));
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.DOWN.worse(HealthStatus.Status.UP));
            assertEquals(HealthStatus.Status.UP, HealthStatus.Status.UP.worse(null));
        }

        @Test
        @DisplayName("withPoolStats() should add slot figures and occupancy percent")
        void withPoolStats() {
            HealthStatus status = HealthStatus.degraded("high")
                    .withDetail("checkedBy", "test")
                    .withPoolStats(new PoolStats(20, 5, 19, 1, 40, 21, 3, 2));

            assertTrue(status.isDegraded());
            assertEquals("test", status.details().get("checkedBy"));
            assertEquals(20, status.details().get("capacity"));
            assertEquals(95L, status.details().get("occupancyPercent"));
            assertEquals(3L, status.details().get("totalExhausted"));
            assertEquals(2L, status.details().get("totalZombiesReclaimed"));
        }
    }

    @Nested
    @DisplayName("ConnectionPoolHealthCheck")
    class ConnectionPoolHealthCheckTests {

        @Test
        @DisplayName("Should be UP with low occupancy")
        void up() {
            SlotConnectionPool pool = pool(10);
            pool.borrow(false);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isUp());
            assertEquals(10, status.details().get("capacity"));
            assertEquals(1, status.details().get("busyConnections"));
        }

        @Test
        @DisplayName("Should be DEGRADED at 90% occupancy")
        void degraded() {
            SlotConnectionPool pool = pool(10);
            for (int i = 0; i < 9; i++) {
                pool.borrow(false);
            }

            assertTrue(new ConnectionPoolHealthCheck(pool).check().isDegraded());
        }

        @Test
        @DisplayName("Should be DOWN when exhausted")
        void down() {
            SlotConnectionPool pool = pool(2);
            pool.borrow(false);
            pool.borrow(false);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isDown());
            assertTrue(status.message().contains("exhausted"));
        }

        @Test
        @DisplayName("Should be DOWN when the stats call fails")
        void statsFailure() {
            DirectoryConnectionPool pool = mock(DirectoryConnectionPool.class);
            when(pool.getStats()).thenThrow(new IllegalStateException("boom"));

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isDown());
            assertTrue(status.message().contains("boom"));
        }
    }

    @Nested
    @DisplayName("DirectoryBackendHealthCheck")
    class DirectoryBackendHealthCheckTests {

        @Test
        @DisplayName("Should be UP and release the checked connection")
        void up() {
            SlotConnectionPool pool = pool(2);

            HealthStatus status = new DirectoryBackendHealthCheck(pool).check();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("latencyMs"));
            assertEquals(0, pool.getStats().busyConnections());
            assertEquals(1, factory.get(0).connectCount());
        }

        @Test
        @DisplayName("Should be DOWN when the backend refuses the bind")
        void down() {
            SlotConnectionPool pool = pool(2);
            factory.get(0).setFailConnect(true);

            HealthStatus status = new DirectoryBackendHealthCheck(pool).check();

            assertTrue(status.isDown());
        }

        @Test
        @DisplayName("Should be DEGRADED when no connection is free")
        void exhausted() {
            SlotConnectionPool pool = pool(1);
            List<DirectoryConnection> held = new ArrayList<>();
            pool.borrow(false).ifPresent(held::add);

            HealthStatus status = new DirectoryBackendHealthCheck(pool).check();

            assertTrue(status.isDegraded());
            assertEquals(1, held.size());
            assertEquals(0, pool.getStats().totalExhausted());
            assertTrue(scheduled.isEmpty());
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck fixed(String name, HealthStatus status) {
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

        @Test
        @DisplayName("Empty registry should be UP")
        void empty() {
            HealthCheckRegistry registry = new HealthCheckRegistry();

            assertTrue(registry.checkAll().isUp());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("Aggregate should report the worst status")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("slow")));
            registry.register(fixed("c", HealthStatus.up()));
            registry.register(null);

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDegraded());
            assertEquals("b: slow", aggregate.message());
            assertEquals(3, registry.size());
            assertEquals("DEGRADED", ((Map<?, ?>) aggregate.details().get("b")).get("status"));
        }

        @Test
        @DisplayName("DOWN should dominate DEGRADED")
        void downDominates() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.degraded("slow")));
            registry.register(fixed("b", HealthStatus.down("gone")));

            assertTrue(registry.checkAll().isDown());
        }

        @Test
        @DisplayName("Should combine pool checks")
        void poolChecks() {
            SlotConnectionPool pool = pool(4);
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new ConnectionPoolHealthCheck(pool));
            registry.register(new DirectoryBackendHealthCheck(pool));

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isUp());
            assertTrue(aggregate.details().containsKey("connectionPool"));
            assertTrue(aggregate.details().containsKey("directoryBackend"));
        }
    }

    @Test
    @DisplayName("PoolStats occupancy should handle an empty pool")
    void occupancy() {
        assertEquals(0.0, new PoolStats(0, 0, 0, 0, 0, 0, 0, 0).occupancy());
        assertEquals(0.5, new PoolStats(4, 1, 2, 2, 5, 3, 0, 0).occupancy());
    }
}
