package com.directory.pool.metrics;

/**
 * No-op implementation of {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void recordBorrowed() {
    }

    @Override
    public void recordReleased() {
    }

    @Override
    public void recordExhausted() {
    }

    @Override
    public void recordConnectFailure() {
    }

    @Override
    public void recordZombiesReclaimed(int count) {
    }

    @Override
    public void recordSnipped(int count) {
    }

    @Override
    public void recordReconfigured() {
    }

    @Override
    public void recordCapacity(int capacity) {
    }
}
