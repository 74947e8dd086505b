package com.directory.pool.health;

import com.directory.pool.connection.DirectoryConnection;
import com.directory.pool.pool.DirectoryConnectionPool;

import java.util.Optional;

/**
 * Health check for directory backend reachability.
 * Borrows a connection, connects and binds it, and measures the latency.
 * An exhausted pool is reported as DEGRADED since the backend state is unknown.
 */
public class DirectoryBackendHealthCheck implements HealthCheck {

    private final DirectoryConnectionPool pool;

    public DirectoryBackendHealthCheck(DirectoryConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "directoryBackend";
    }

    @Override
    public HealthStatus check() {
        long startMs;
        Optional<DirectoryConnection> borrowed;
        try {
            // Borrowing from a full pool would register as an exhaustion
            if (pool.getStats().freeConnections() == 0) {
                return HealthStatus.degraded("No free connection to probe the directory backend");
            }
            startMs = System.currentTimeMillis();
            borrowed = pool.borrow(true);
        } catch (RuntimeException e) {
            return HealthStatus.down("Directory backend check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        long latencyMs = System.currentTimeMillis() - startMs;

        if (borrowed.isEmpty()) {
            if (pool.getStats().freeConnections() == 0) {
                return HealthStatus.degraded("No free connection to probe the directory backend");
            }
            return HealthStatus.down("Directory backend connect failed")
                    .withDetail("latencyMs", latencyMs);
        }

        DirectoryConnection connection = borrowed.get();
        try {
            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("poolIndex", connection.getPoolIndex());
        } finally {
            pool.release(connection);
        }
    }
}
