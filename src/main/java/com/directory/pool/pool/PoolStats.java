package com.directory.pool.pool;

/**
 * Statistics for a {@link DirectoryConnectionPool}.
 *
 * @param capacity               current number of slots
 * @param warmStartCount         slots eagerly connected on (re)configuration
 * @param busyConnections        slots currently borrowed
 * @param freeConnections        slots available for borrowing
 * @param totalBorrowed          cumulative successful borrows since pool creation
 * @param totalReleased          cumulative releases since pool creation
 * @param totalExhausted         cumulative borrows that found no free slot
 * @param totalZombiesReclaimed  cumulative zombie connections returned to the pool
 */
public record PoolStats(
        int capacity,
        int warmStartCount,
        int busyConnections,
        int freeConnections,
        long totalBorrowed,
        long totalReleased,
        long totalExhausted,
        long totalZombiesReclaimed
) {

    /**
     * Fraction of slots currently borrowed, 0.0 for an empty pool.
     */
    public double occupancy() {
        return capacity > 0 ? (double) busyConnections / capacity : 0.0;
    }
}
