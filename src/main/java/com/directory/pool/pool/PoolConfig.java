package com.directory.pool.pool;

import com.directory.pool.connection.BackendConfig;

import java.time.Duration;

/**
 * Configuration for {@link SlotConnectionPool}: pool sizing, backend endpoints,
 * trust anchors and bind identity.
 *
 * <p>{@code reconfigure} replaces every setting and pushes {@code zombieTimeout} to all
 * connections. {@code connectTimeout} is only read when the pool is built with the
 * default LDAP factory.</p>
 */
public class PoolConfig {

    private final String name;
    private final int initialSize;
    private final int maxSize;
    private final String host;
    private final int port;
    private final String fallbackHost;
    private final int fallbackPort;
    private final boolean useSsl;
    private final boolean useTls;
    private final String caPath;
    private final String bindDn;
    private final String bindPassword;
    private final Duration zombieTimeout;
    private final Duration connectTimeout;

    private PoolConfig(Builder builder) {
        this.name = builder.name;
        this.initialSize = builder.initialSize;
        this.maxSize = builder.maxSize;
        this.host = builder.host;
        this.port = builder.port;
        this.fallbackHost = builder.fallbackHost;
        this.fallbackPort = builder.fallbackPort;
        this.useSsl = builder.useSsl;
        this.useTls = builder.useTls;
        this.caPath = builder.caPath;
        this.bindDn = builder.bindDn;
        this.bindPassword = builder.bindPassword;
        this.zombieTimeout = builder.zombieTimeout;
        this.connectTimeout = builder.connectTimeout;
    }

    public String getName() { return name; }
    public int getInitialSize() { return initialSize; }
    public int getMaxSize() { return maxSize; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getFallbackHost() { return fallbackHost; }
    public int getFallbackPort() { return fallbackPort; }
    public boolean isUseSsl() { return useSsl; }
    public boolean isUseTls() { return useTls; }
    public String getCaPath() { return caPath; }
    public String getBindDn() { return bindDn; }
    public String getBindPassword() { return bindPassword; }
    public Duration getZombieTimeout() { return zombieTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }

    /**
     * Endpoint parameters handed to every connection.
     */
    public BackendConfig toBackendConfig() {
        return new BackendConfig(host, port, fallbackHost, fallbackPort, useSsl, useTls);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .initialSize(initialSize)
                .maxSize(maxSize)
                .host(host)
                .port(port)
                .fallbackHost(fallbackHost)
                .fallbackPort(fallbackPort)
                .useSsl(useSsl)
                .useTls(useTls)
                .caPath(caPath)
                .bindDn(bindDn)
                .bindPassword(bindPassword)
                .zombieTimeout(zombieTimeout)
                .connectTimeout(connectTimeout);
    }

    public static class Builder {
        private String name = "directory";
        private int initialSize = 10;
        private int maxSize = 1000;
        private String host = "localhost";
        private int port = 389;
        private String fallbackHost = "";
        private int fallbackPort = 389;
        private boolean useSsl = false;
        private boolean useTls = false;
        private String caPath = "";
        private String bindDn = "";
        private String bindPassword = "";
        private Duration zombieTimeout = Duration.ofSeconds(120);
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Builder name(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            this.name = name;
            return this;
        }

        public Builder initialSize(int initialSize) {
            if (initialSize < 0) throw new IllegalArgumentException("initialSize must be >= 0");
            this.initialSize = initialSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
            this.maxSize = maxSize;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder fallbackHost(String fallbackHost) {
            this.fallbackHost = fallbackHost != null ? fallbackHost : "";
            return this;
        }

        public Builder fallbackPort(int fallbackPort) {
            this.fallbackPort = fallbackPort;
            return this;
        }

        public Builder useSsl(boolean useSsl) {
            this.useSsl = useSsl;
            return this;
        }

        public Builder useTls(boolean useTls) {
            this.useTls = useTls;
            return this;
        }

        public Builder caPath(String caPath) {
            this.caPath = caPath != null ? caPath : "";
            return this;
        }

        public Builder bindDn(String bindDn) {
            this.bindDn = bindDn != null ? bindDn : "";
            return this;
        }

        public Builder bindPassword(String bindPassword) {
            this.bindPassword = bindPassword != null ? bindPassword : "";
            return this;
        }

        public Builder zombieTimeout(Duration zombieTimeout) {
            if (zombieTimeout == null || zombieTimeout.isNegative() || zombieTimeout.isZero()) {
                throw new IllegalArgumentException("zombieTimeout must be > 0");
            }
            this.zombieTimeout = zombieTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalArgumentException("connectTimeout must be > 0");
            }
            this.connectTimeout = connectTimeout;
            return this;
        }

        public PoolConfig build() {
            if (initialSize > maxSize) {
                throw new IllegalArgumentException("initialSize cannot exceed maxSize");
            }
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank");
            }
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be in 1..65535");
            }
            if (!fallbackHost.isBlank() && (fallbackPort <= 0 || fallbackPort > 65535)) {
                throw new IllegalArgumentException("fallbackPort must be in 1..65535");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "name='" + name + '\'' +
                ", initialSize=" + initialSize +
                ", maxSize=" + maxSize +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", fallbackHost='" + fallbackHost + '\'' +
                ", fallbackPort=" + fallbackPort +
                ", useSsl=" + useSsl +
                ", useTls=" + useTls +
                ", caPath='" + caPath + '\'' +
                ", bindDn='" + bindDn + '\'' +
                ", zombieTimeout=" + zombieTimeout +
                ", connectTimeout=" + connectTimeout +
                '}';
    }
}
