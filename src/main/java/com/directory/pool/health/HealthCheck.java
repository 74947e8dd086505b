package com.directory.pool.health;

/**
 * A named probe of one component of the directory pool, such as slot occupancy
 * or backend reachability.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe. Implementations report failures as a DOWN status instead of throwing.
     */
    HealthStatus check();
}
