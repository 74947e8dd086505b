package com.directory.pool.connection;

import java.time.Duration;

/**
 * A single link to the directory backend, owned by a connection pool.
 * Besides the session itself, a connection carries the slot markers the pool
 * relies on: busy/free, snipped and its index within the pool.
 */
public interface DirectoryConnection extends AutoCloseable {

    /**
     * Establishes (or re-establishes) the backend session and binds with the given identity.
     * An existing session is dropped first.
     *
     * @param bindDn       the bind identity
     * @param bindPassword the bind credential
     * @return the connect status and the server response text
     */
    ConnectResult connect(String bindDn, String bindPassword);

    /**
     * Replaces the target endpoints. Takes effect on the next {@link #connect}.
     */
    void configure(BackendConfig backendConfig);

    /**
     * Replaces how long a borrower may hold this connection before it counts as a zombie.
     * Applies to the current loan as well.
     */
    void setZombieTimeout(Duration zombieTimeout);

    /**
     * Checks whether the backend session is currently established.
     */
    boolean isConnected();

    void markBusy();

    void markFree();

    boolean isBusy();

    /**
     * A zombie is a connection still marked busy whose borrower has held it beyond
     * the zombie timeout. The session state is not consulted: a lazily borrowed
     * connection is legitimately unconnected.
     */
    boolean isZombie();

    /**
     * Marks this connection as removed from the pool's addressable range.
     * A snipped connection is closed on release instead of being recycled.
     */
    void markSnipped();

    boolean isSnipped();

    /**
     * Gets the slot index this connection was created for.
     */
    int getPoolIndex();

    /**
     * Closes the backend session. Never throws.
     */
    @Override
    void close();
}
