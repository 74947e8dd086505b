package com.directory.pool.metrics;

/**
 * Interface for recording connection pool events.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpPoolMetrics} does nothing, ensuring the pool works
 * without any metrics dependencies on the classpath.
 */
public interface PoolMetrics {

    void recordBorrowed();

    void recordReleased();

    void recordExhausted();

    void recordConnectFailure();

    void recordZombiesReclaimed(int count);

    void recordSnipped(int count);

    void recordReconfigured();

    void recordCapacity(int capacity);
}
