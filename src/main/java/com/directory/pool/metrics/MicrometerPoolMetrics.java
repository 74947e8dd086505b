package com.directory.pool.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link PoolMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics (all tagged with {@code pool}):</p>
 * <ul>
 *   <li>{@code directory.pool.borrowed} — Counter</li>
 *   <li>{@code directory.pool.released} — Counter</li>
 *   <li>{@code directory.pool.exhausted} — Counter</li>
 *   <li>{@code directory.pool.connect.failures} — Counter</li>
 *   <li>{@code directory.pool.zombies.reclaimed} — Counter</li>
 *   <li>{@code directory.pool.snipped} — Counter</li>
 *   <li>{@code directory.pool.reconfigured} — Counter</li>
 *   <li>{@code directory.pool.capacity} — Gauge</li>
 * </ul>
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final Counter borrowedCounter;
    private final Counter releasedCounter;
    private final Counter exhaustedCounter;
    private final Counter connectFailureCounter;
    private final Counter zombieCounter;
    private final Counter snippedCounter;
    private final Counter reconfiguredCounter;
    private final AtomicInteger capacity = new AtomicInteger();

    public MicrometerPoolMetrics(MeterRegistry registry) {
        this(registry, "default");
    }

    public MicrometerPoolMetrics(MeterRegistry registry, String poolName) {
        this.borrowedCounter = Counter.builder("directory.pool.borrowed")
                .description("Number of connections handed out")
                .tag("pool", poolName)
                .register(registry);
        this.releasedCounter = Counter.builder("directory.pool.released")
                .description("Number of connections returned")
                .tag("pool", poolName)
                .register(registry);
        this.exhaustedCounter = Counter.builder("directory.pool.exhausted")
                .description("Number of borrows that found no free slot")
                .tag("pool", poolName)
                .register(registry);
        this.connectFailureCounter = Counter.builder("directory.pool.connect.failures")
                .description("Number of failed connects during borrow")
                .tag("pool", poolName)
                .register(registry);
        this.zombieCounter = Counter.builder("directory.pool.zombies.reclaimed")
                .description("Number of zombie connections freed")
                .tag("pool", poolName)
                .register(registry);
        this.snippedCounter = Counter.builder("directory.pool.snipped")
                .description("Number of connections removed by a shrink")
                .tag("pool", poolName)
                .register(registry);
        this.reconfiguredCounter = Counter.builder("directory.pool.reconfigured")
                .description("Number of pool reconfigurations")
                .tag("pool", poolName)
                .register(registry);
        registry.gauge("directory.pool.capacity",
                Tags.of("pool", poolName), capacity);
    }

    @Override
    public void recordBorrowed() {
        borrowedCounter.increment();
    }

    @Override
    public void recordReleased() {
        releasedCounter.increment();
    }

    @Override
    public void recordExhausted() {
        exhaustedCounter.increment();
    }

    @Override
    public void recordConnectFailure() {
        connectFailureCounter.increment();
    }

    @Override
    public void recordZombiesReclaimed(int count) {
        if (count > 0) {
            zombieCounter.increment(count);
        }
    }

    @Override
    public void recordSnipped(int count) {
        if (count > 0) {
            snippedCounter.increment(count);
        }
    }

    @Override
    public void recordReconfigured() {
        reconfiguredCounter.increment();
    }

    @Override
    public void recordCapacity(int capacity) {
        this.capacity.set(capacity);
    }
}
