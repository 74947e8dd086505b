package com.directory.pool.health;

import com.directory.pool.pool.DirectoryConnectionPool;
import com.directory.pool.pool.PoolStats;

/**
 * Health check for slot occupancy of a {@link DirectoryConnectionPool}.
 * DOWN when every slot is borrowed, DEGRADED from the occupancy at which the pool
 * starts sweeping for zombies.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.90;

    private final DirectoryConnectionPool pool;

    public ConnectionPoolHealthCheck(DirectoryConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        try {
            PoolStats stats = pool.getStats();
            double occupancy = stats.occupancy();

            HealthStatus base;
            if (stats.capacity() == 0) {
                base = HealthStatus.down("Connection pool has no slots");
            } else if (stats.freeConnections() == 0) {
                base = HealthStatus.down("Connection pool exhausted: all " + stats.capacity() + " slots busy");
            } else if (occupancy >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high: " +
                        String.format("%.0f%%", occupancy * 100));
            } else {
                base = HealthStatus.up();
            }

            return base.withPoolStats(stats);
        } catch (RuntimeException e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
