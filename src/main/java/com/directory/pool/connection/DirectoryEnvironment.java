package com.directory.pool.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.Objects;

/**
 * Process-wide directory client parameters, set once before any connection is used.
 *
 * <p>The first call to {@link #initialize(String)} wins; later calls are ignored.
 * Connections read the trust anchors from here when negotiating LDAPS or StartTLS.</p>
 *
 * <pre>
 * DirectoryEnvironment.initialize("/etc/ssl/certs/directory-ca.pem");
 * TrustManager[] trust = DirectoryEnvironment.trustManagers();
 * </pre>
 */
public final class DirectoryEnvironment {
    private static final Logger log = LoggerFactory.getLogger(DirectoryEnvironment.class);

    private static final Object LOCK = new Object();
    private static boolean initialized;
    private static String caPath = "";
    private static TrustManager[] trustManagers;

    private DirectoryEnvironment() {
        // Utility class
    }

    /**
     * Sets the trust anchor path used by every connection of this process.
     *
     * @param caPath PEM or DER certificate file, blank for the JVM default trust store
     * @return true if this call performed the initialisation
     */
    public static boolean initialize(String caPath) {
        String path = caPath != null ? caPath.trim() : "";
        synchronized (LOCK) {
            if (initialized) {
                if (!Objects.equals(DirectoryEnvironment.caPath, path)) {
                    log.debug("Directory environment already initialized with caPath='{}', ignoring '{}'",
                            DirectoryEnvironment.caPath, path);
                }
                return false;
            }
            DirectoryEnvironment.caPath = path;
            initialized = true;
            log.info("Directory environment initialized (caPath='{}')", path);
            return true;
        }
    }

    public static boolean isInitialized() {
        synchronized (LOCK) {
            return initialized;
        }
    }

    public static String caPath() {
        synchronized (LOCK) {
            return caPath;
        }
    }

    /**
     * Returns the trust managers built from the configured CA file, loading them on first use.
     *
     * @throws DirectoryException if the CA file cannot be read or parsed
     */
    public static TrustManager[] trustManagers() {
        synchronized (LOCK) {
            if (trustManagers == null) {
                trustManagers = loadTrustManagers(caPath);
            }
            return trustManagers.clone();
        }
    }

    static void reset() {
        synchronized (LOCK) {
            initialized = false;
            caPath = "";
            trustManagers = null;
        }
    }

    private static TrustManager[] loadTrustManagers(String path) {
        try {
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            if (path.isEmpty()) {
                factory.init((KeyStore) null);
                return factory.getTrustManagers();
            }

            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            Collection<? extends Certificate> certificates;
            try (InputStream in = Files.newInputStream(Path.of(path))) {
                certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
            }
            if (certificates.isEmpty()) {
                throw new DirectoryException("No certificates found in CA file: " + path);
            }
            int i = 0;
            for (Certificate certificate : certificates) {
                keyStore.setCertificateEntry("directory-ca-" + i++, certificate);
            }
            factory.init(keyStore);
            log.debug("Loaded {} trust anchor(s) from {}", certificates.size(), path);
            return factory.getTrustManagers();
        } catch (IOException | GeneralSecurityException e) {
            throw new DirectoryException("Failed to load trust anchors from '" + path + "'", e);
        }
    }
}
