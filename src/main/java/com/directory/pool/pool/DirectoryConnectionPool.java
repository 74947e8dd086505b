package com.directory.pool.pool;

import com.directory.pool.connection.DirectoryConnection;

import java.util.Map;
import java.util.Optional;

/**
 * Bounded, resizable pool of {@link DirectoryConnection} instances.
 * Provides borrow/release semantics with exclusive use of a connection per borrower.
 */
public interface DirectoryConnectionPool extends AutoCloseable {

    /**
     * Borrows a free connection. Never waits for one to become available.
     *
     * @param connect whether to (re)connect and bind the connection before handing it out
     * @return the connection, or empty if the pool is exhausted or the connect failed
     */
    Optional<DirectoryConnection> borrow(boolean connect);

    /**
     * Borrows a free connection, connecting it first.
     */
    default Optional<DirectoryConnection> borrow() {
        return borrow(true);
    }

    /**
     * Returns a connection to the pool.
     *
     * @param connection the connection to release, ignored if null
     */
    void release(DirectoryConnection connection);

    /**
     * Applies new sizing, endpoints and bind identity without invalidating current borrows.
     */
    void reconfigure(PoolConfig config);

    /**
     * Frees every borrowed connection that reports itself as a zombie.
     *
     * @return the number of slots reclaimed
     */
    int zombieControl();

    /**
     * Replaces the group to role mapping from its delimited form.
     */
    void resetGroupRoleMapping(String mapping);

    /**
     * Returns the current group to role mapping.
     */
    Map<String, String> getGroupRoleMapping();

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes the pool. Free connections are closed; borrowed ones are closed on release.
     */
    @Override
    void close();
}
