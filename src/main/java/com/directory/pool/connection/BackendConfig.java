package com.directory.pool.connection;

/**
 * Target endpoints shared by every connection of a pool.
 *
 * @param host         primary directory host
 * @param port         primary directory port
 * @param fallbackHost host tried when the primary cannot be reached, may be blank
 * @param fallbackPort fallback port, ignored without a fallback host
 * @param useSsl       connect with LDAPS
 * @param useTls       upgrade a plain connection with StartTLS
 */
public record BackendConfig(String host, int port, String fallbackHost, int fallbackPort,
                            boolean useSsl, boolean useTls) {

    public BackendConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in 1..65535");
        }
        fallbackHost = fallbackHost != null ? fallbackHost : "";
        if (!fallbackHost.isBlank() && (fallbackPort <= 0 || fallbackPort > 65535)) {
            throw new IllegalArgumentException("fallbackPort must be in 1..65535");
        }
    }

    public boolean hasFallback() {
        return !fallbackHost.isBlank();
    }
}
