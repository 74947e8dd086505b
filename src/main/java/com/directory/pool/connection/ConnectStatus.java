package com.directory.pool.connection;

/**
 * Outcome of a {@link DirectoryConnection#connect} call.
 */
public enum ConnectStatus {
    SUCCESS,
    FAILURE
}
