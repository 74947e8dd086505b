package com.directory.pool.connection;

/**
 * Creates the connection living in a given pool slot.
 */
@FunctionalInterface
public interface DirectoryConnectionFactory {

    /**
     * @param poolIndex     the slot index the connection belongs to
     * @param backendConfig the endpoints to connect to
     */
    DirectoryConnection create(int poolIndex, BackendConfig backendConfig);
}
