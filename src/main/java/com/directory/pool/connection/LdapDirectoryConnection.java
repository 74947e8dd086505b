package com.directory.pool.connection;

import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.ldap.client.api.LdapConnection;
import org.apache.directory.ldap.client.api.LdapConnectionConfig;
import org.apache.directory.ldap.client.api.LdapNetworkConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * LDAP implementation of {@link DirectoryConnection} using the Apache Directory LDAP API.
 *
 * <p>{@link #connect} drops any existing session, tries the primary host and then the
 * fallback host, and performs a simple bind (anonymous when the bind DN is blank).
 * LDAPS is used when SSL is enabled; otherwise StartTLS is negotiated when TLS is
 * enabled. Trust anchors come from {@link DirectoryEnvironment}.</p>
 *
 * <p>The session is not thread-safe; the pool hands each connection to one borrower
 * at a time.</p>
 */
public class LdapDirectoryConnection extends AbstractDirectoryConnection {
    private static final Logger log = LoggerFactory.getLogger(LdapDirectoryConnection.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration connectTimeout;
    private final Object sessionLock = new Object();
    private LdapNetworkConnection session;

    public LdapDirectoryConnection(int poolIndex, BackendConfig backendConfig) {
        this(poolIndex, backendConfig, DEFAULT_ZOMBIE_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, Clock.systemUTC());
    }

    public LdapDirectoryConnection(int poolIndex, BackendConfig backendConfig,
                                   Duration zombieTimeout, Duration connectTimeout, Clock clock) {
        super(poolIndex, backendConfig, zombieTimeout, clock);
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        this.connectTimeout = connectTimeout;
    }

    /**
     * Factory creating LDAP connections with the given timeouts.
     */
    public static DirectoryConnectionFactory factory(Duration zombieTimeout, Duration connectTimeout) {
        return (poolIndex, backendConfig) -> new LdapDirectoryConnection(
                poolIndex, backendConfig, zombieTimeout, connectTimeout, Clock.systemUTC());
    }

    @Override
    public ConnectResult connect(String bindDn, String bindPassword) {
        BackendConfig config = getBackendConfig();
        synchronized (sessionLock) {
            closeSession();

            ConnectResult result = connectTo(config.host(), config.port(), config, bindDn, bindPassword);
            if (!result.isSuccess() && config.hasFallback()) {
                log.warn("Connection {} to {}:{} failed ({}), trying fallback {}:{}",
                        getPoolIndex(), config.host(), config.port(), result.response(),
                        config.fallbackHost(), config.fallbackPort());
                result = connectTo(config.fallbackHost(), config.fallbackPort(), config, bindDn, bindPassword);
            }
            return result;
        }
    }

    private ConnectResult connectTo(String host, int port, BackendConfig config,
                                    String bindDn, String bindPassword) {
        LdapNetworkConnection candidate = null;
        try {
            candidate = openSession(host, port, config);
            if (!candidate.connect()) {
                closeQuietly(candidate);
                return ConnectResult.failure("Unable to connect to " + host + ":" + port);
            }
            if (bindDn == null || bindDn.isBlank()) {
                candidate.anonymousBind();
            } else {
                candidate.bind(bindDn, bindPassword != null ? bindPassword : "");
            }
            session = candidate;
            log.debug("Connection {} bound to {}:{}", getPoolIndex(), host, port);
            return ConnectResult.success("Bound to " + host + ":" + port);
        } catch (LdapException | DirectoryException e) {
            closeQuietly(candidate);
            log.debug("Connection {} to {}:{} failed: {}", getPoolIndex(), host, port, e.getMessage());
            return ConnectResult.failure(e.getMessage());
        }
    }

    /**
     * Creates an unconnected session for the given endpoint.
     */
    protected LdapNetworkConnection openSession(String host, int port, BackendConfig config) {
        LdapConnectionConfig connectionConfig = new LdapConnectionConfig();
        connectionConfig.setLdapHost(host);
        connectionConfig.setLdapPort(port);
        connectionConfig.setUseSsl(config.useSsl());
        connectionConfig.setUseTls(config.useTls() && !config.useSsl());
        connectionConfig.setTimeout(connectTimeout.toMillis());
        if (config.useSsl() || config.useTls()) {
            connectionConfig.setTrustManagers(DirectoryEnvironment.trustManagers());
        }
        return new LdapNetworkConnection(connectionConfig);
    }

    /**
     * Returns the bound session for use by the current borrower, empty when not connected.
     */
    public Optional<LdapConnection> session() {
        synchronized (sessionLock) {
            return Optional.ofNullable(session);
        }
    }

    @Override
    public boolean isConnected() {
        synchronized (sessionLock) {
            return session != null && session.isConnected() && session.isAuthenticated();
        }
    }

    @Override
    public void close() {
        synchronized (sessionLock) {
            closeSession();
        }
    }

    private void closeSession() {
        if (session != null) {
            closeQuietly(session);
            session = null;
        }
    }

    private void closeQuietly(LdapNetworkConnection connection) {
        if (connection == null) {
            return;
        }
        connection.close();
    }
}
