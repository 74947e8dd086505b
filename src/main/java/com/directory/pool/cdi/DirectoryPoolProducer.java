package com.directory.pool.cdi;

import com.directory.pool.connection.LdapDirectoryConnection;
import com.directory.pool.health.ConnectionPoolHealthCheck;
import com.directory.pool.health.DirectoryBackendHealthCheck;
import com.directory.pool.health.HealthCheckRegistry;
import com.directory.pool.metrics.MicrometerPoolMetrics;
import com.directory.pool.metrics.NoOpPoolMetrics;
import com.directory.pool.metrics.PoolMetrics;
import com.directory.pool.pool.DirectoryConnectionPool;
import com.directory.pool.pool.PoolConfig;
import com.directory.pool.pool.SlotConnectionPool;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the directory connection pool from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * directory-pool:
 *   initial-size: 10
 *   max-size: 1000
 *   host: ldap.example.com
 *   port: 389
 *   fallback-host: ldap2.example.com
 *   fallback-port: 389
 *   use-ssl: false
 *   use-tls: true
 *   ca-path: /etc/ssl/certs/directory-ca.pem
 *   bind-dn: cn=reader,dc=example,dc=com
 *   bind-password: secret
 *   group-role-mapping: admins=root,developers
 * </pre>
 */
@ApplicationScoped
public class DirectoryPoolProducer {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPoolProducer.class);

    // ── Pool ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "directory-pool.name", defaultValue = "directory")
    String poolName;

    @Inject
    @ConfigProperty(name = "directory-pool.initial-size", defaultValue = "10")
    int initialSize;

    @Inject
    @ConfigProperty(name = "directory-pool.max-size", defaultValue = "1000")
    int maxSize;

    @Inject
    @ConfigProperty(name = "directory-pool.zombie-timeout-seconds", defaultValue = "120")
    long zombieTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "directory-pool.connect-timeout-millis", defaultValue = "10000")
    long connectTimeoutMillis;

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "directory-pool.host", defaultValue = "localhost")
    String host;

    @Inject
    @ConfigProperty(name = "directory-pool.port", defaultValue = "389")
    int port;

    @Inject
    @ConfigProperty(name = "directory-pool.fallback-host")
    Optional<String> fallbackHost;

    @Inject
    @ConfigProperty(name = "directory-pool.fallback-port", defaultValue = "389")
    int fallbackPort;

    @Inject
    @ConfigProperty(name = "directory-pool.use-ssl", defaultValue = "false")
    boolean useSsl;

    @Inject
    @ConfigProperty(name = "directory-pool.use-tls", defaultValue = "false")
    boolean useTls;

    @Inject
    @ConfigProperty(name = "directory-pool.ca-path")
    Optional<String> caPath;

    // ── Bind identity ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "directory-pool.bind-dn")
    Optional<String> bindDn;

    @Inject
    @ConfigProperty(name = "directory-pool.bind-password")
    Optional<String> bindPassword;

    @Inject
    @ConfigProperty(name = "directory-pool.group-role-mapping")
    Optional<String> groupRoleMapping;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "directory-pool.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PoolConfig poolConfig() {
        return PoolConfig.builder()
                .name(poolName)
                .initialSize(initialSize)
                .maxSize(maxSize)
                .host(host)
                .port(port)
                .fallbackHost(fallbackHost.orElse(""))
                .fallbackPort(fallbackPort)
                .useSsl(useSsl)
                .useTls(useTls)
                .caPath(caPath.orElse(""))
                .bindDn(bindDn.orElse(""))
                .bindPassword(bindPassword.orElse(""))
                .zombieTimeout(Duration.ofSeconds(zombieTimeoutSeconds))
                .connectTimeout(Duration.ofMillis(connectTimeoutMillis))
                .build();
    }

    @Produces
    @ApplicationScoped
    public PoolMetrics poolMetrics() {
        if (metricsEnabled && meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Pool metrics enabled: Micrometer");
            return new MicrometerPoolMetrics(meterRegistry.get(), poolName);
        }
        log.info("Pool metrics disabled");
        return new NoOpPoolMetrics();
    }

    @Produces
    @ApplicationScoped
    public DirectoryConnectionPool directoryConnectionPool(PoolConfig config, PoolMetrics metrics) {
        log.info("Producing DirectoryConnectionPool: {}:{} (fallback='{}') max={} initial={}",
                config.getHost(), config.getPort(), config.getFallbackHost(),
                config.getMaxSize(), config.getInitialSize());

        SlotConnectionPool pool = new SlotConnectionPool(config,
                LdapDirectoryConnection.factory(config.getZombieTimeout(), config.getConnectTimeout()),
                metrics);
        groupRoleMapping.ifPresent(pool::resetGroupRoleMapping);
        return pool;
    }

    public void closePool(@Disposes DirectoryConnectionPool pool) {
        log.info("Closing DirectoryConnectionPool");
        pool.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(DirectoryConnectionPool pool) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new ConnectionPoolHealthCheck(pool));
        registry.register(new DirectoryBackendHealthCheck(pool));
        return registry;
    }
}
