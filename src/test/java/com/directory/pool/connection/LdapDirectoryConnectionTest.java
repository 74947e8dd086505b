package com.directory.pool.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LdapDirectoryConnectionTest {

    private static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private LdapDirectoryConnection connection(BackendConfig backend) {
        return new LdapDirectoryConnection(0, backend, Duration.ofSeconds(120), Duration.ofSeconds(2),
                Clock.systemUTC());
    }

    @Test
    @DisplayName("New connection should not be connected")
    void testInitialState() {
        LdapDirectoryConnection conn = new LdapDirectoryConnection(4,
                new BackendConfig("localhost", 389, "", 0, false, false));

        assertFalse(conn.isConnected());
        assertTrue(conn.session().isEmpty());
        assertEquals(4, conn.getPoolIndex());
        assertEquals(AbstractDirectoryConnection.DEFAULT_ZOMBIE_TIMEOUT, conn.getZombieTimeout());
    }

    @Test
    @DisplayName("Connect to an unreachable host should fail with a response")
    void testConnectFailure() throws IOException {
        LdapDirectoryConnection conn = connection(
                new BackendConfig("127.0.0.1", unusedPort(), "", 0, false, false));

        ConnectResult result = assertTimeoutPreemptively(Duration.ofSeconds(30),
                () -> conn.connect("cn=reader,dc=example,dc=com", "secret"));

        assertEquals(ConnectStatus.FAILURE, result.status());
        assertNotNull(result.response());
        assertFalse(conn.isConnected());
    }

    @Test
    @DisplayName("Connect should try the fallback endpoint when the primary fails")
    void testFallbackAttempted() throws IOException {
        int primaryPort = unusedPort();
        int fallbackPort = unusedPort();
        StringBuilder attempts = new StringBuilder();
        LdapDirectoryConnection conn = new LdapDirectoryConnection(0,
                new BackendConfig("127.0.0.1", primaryPort, "127.0.0.1", fallbackPort, false, false),
                Duration.ofSeconds(120), Duration.ofSeconds(2), Clock.systemUTC()) {
            @Override
            protected org.apache.directory.ldap.client.api.LdapNetworkConnection openSession(
                    String host, int port, BackendConfig config) {
                attempts.append(port).append(';');
                return super.openSession(host, port, config);
            }
        };

        ConnectResult result = assertTimeoutPreemptively(Duration.ofSeconds(60), () -> conn.connect("", ""));

        assertFalse(result.isSuccess());
        assertEquals(primaryPort + ";" + fallbackPort + ";", attempts.toString());
    }

    @Test
    @DisplayName("Close without a session should be a no-op")
    void testCloseWithoutSession() {
        LdapDirectoryConnection conn = new LdapDirectoryConnection(0,
                new BackendConfig("localhost", 389, "", 0, false, false));

        assertDoesNotThrow(conn::close);
        assertFalse(conn.isConnected());
    }

    @Test
    @DisplayName("Factory should create connections with the requested index")
    void testFactory() {
        DirectoryConnectionFactory factory = LdapDirectoryConnection.factory(
                Duration.ofSeconds(30), Duration.ofSeconds(1));

        DirectoryConnection conn = factory.create(7, new BackendConfig("localhost", 389, "", 0, false, false));

        assertInstanceOf(LdapDirectoryConnection.class, conn);
        assertEquals(7, conn.getPoolIndex());
        assertEquals(Duration.ofSeconds(30), ((LdapDirectoryConnection) conn).getZombieTimeout());
    }

    @Test
    @DisplayName("Should reject a non-positive connect timeout")
    void testConnectTimeoutValidation() {
        BackendConfig backend = new BackendConfig("localhost", 389, "", 0, false, false);
        assertThrows(IllegalArgumentException.class, () -> new LdapDirectoryConnection(0, backend,
                Duration.ofSeconds(1), Duration.ZERO, Clock.systemUTC()));
    }
}
