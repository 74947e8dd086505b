package com.directory.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoolMetrics Tests")
class PoolMetricsTest {

    @Nested
    @DisplayName("NoOpPoolMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpPoolMetrics noOp = new NoOpPoolMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordBorrowed();
                noOp.recordReleased();
                noOp.recordExhausted();
                noOp.recordConnectFailure();
                noOp.recordZombiesReclaimed(3);
                noOp.recordSnipped(2);
                noOp.recordReconfigured();
                noOp.recordCapacity(10);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPoolMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerPoolMetrics metrics = new MicrometerPoolMetrics(registry, "auth");

        private double count(String name) {
            Counter counter = registry.find(name).tag("pool", "auth").counter();
            assertNotNull(counter, name);
            return counter.count();
        }

        @Test
        @DisplayName("Should count borrows and releases")
        void borrowAndRelease() {
            metrics.recordBorrowed();
            metrics.recordBorrowed();
            metrics.recordReleased();

            assertEquals(2.0, count("directory.pool.borrowed"));
            assertEquals(1.0, count("directory.pool.released"));
        }

        @Test
        @DisplayName("Should count exhaustion and connect failures")
        void failures() {
            metrics.recordExhausted();
            metrics.recordConnectFailure();
            metrics.recordConnectFailure();

            assertEquals(1.0, count("directory.pool.exhausted"));
            assertEquals(2.0, count("directory.pool.connect.failures"));
        }

        @Test
        @DisplayName("Should add reclaimed zombies and snipped connections")
        void batchCounts() {
            metrics.recordZombiesReclaimed(3);
            metrics.recordZombiesReclaimed(0);
            metrics.recordSnipped(2);

            assertEquals(3.0, count("directory.pool.zombies.reclaimed"));
            assertEquals(2.0, count("directory.pool.snipped"));
        }

        @Test
        @DisplayName("Should track reconfigurations and current capacity")
        void capacity() {
            metrics.recordCapacity(5);
            metrics.recordReconfigured();
            metrics.recordCapacity(12);

            assertEquals(1.0, count("directory.pool.reconfigured"));
            Gauge gauge = registry.find("directory.pool.capacity").tag("pool", "auth").gauge();
            assertNotNull(gauge);
            assertEquals(12.0, gauge.value());
        }
    }
}
