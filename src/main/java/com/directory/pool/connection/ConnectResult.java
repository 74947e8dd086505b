package com.directory.pool.connection;

/**
 * Result of connecting and binding a {@link DirectoryConnection}.
 *
 * @param status   whether the session was established and bound
 * @param response the server (or client library) response text, never null
 */
public record ConnectResult(ConnectStatus status, String response) {

    public ConnectResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        response = response != null ? response : "";
    }

    public static ConnectResult success(String response) {
        return new ConnectResult(ConnectStatus.SUCCESS, response);
    }

    public static ConnectResult failure(String response) {
        return new ConnectResult(ConnectStatus.FAILURE, response);
    }

    public boolean isSuccess() {
        return status == ConnectStatus.SUCCESS;
    }
}
