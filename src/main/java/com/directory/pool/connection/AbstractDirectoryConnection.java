package com.directory.pool.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Slot-state bookkeeping shared by {@link DirectoryConnection} implementations.
 *
 * <p>Tracks the busy flag together with the instant of the borrow, so that a
 * connection held longer than the zombie timeout can be reclaimed by the pool.
 * Subclasses provide the session handling ({@link #connect}, {@link #isConnected},
 * {@link #close}).</p>
 */
public abstract class AbstractDirectoryConnection implements DirectoryConnection {

    public static final Duration DEFAULT_ZOMBIE_TIMEOUT = Duration.ofSeconds(120);

    private final int poolIndex;
    private volatile Duration zombieTimeout;
    private final Clock clock;
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private volatile boolean snipped;
    private volatile Instant borrowedAt;
    private volatile BackendConfig backendConfig;

    protected AbstractDirectoryConnection(int poolIndex, BackendConfig backendConfig,
                                          Duration zombieTimeout, Clock clock) {
        if (poolIndex < 0) {
            throw new IllegalArgumentException("poolIndex must be >= 0");
        }
        this.poolIndex = poolIndex;
        this.backendConfig = backendConfig;
        this.zombieTimeout = requirePositive(zombieTimeout);
        this.clock = clock;
    }

    private static Duration requirePositive(Duration zombieTimeout) {
        if (zombieTimeout == null || zombieTimeout.isNegative() || zombieTimeout.isZero()) {
            throw new IllegalArgumentException("zombieTimeout must be > 0");
        }
        return zombieTimeout;
    }

    @Override
    public void configure(BackendConfig backendConfig) {
        this.backendConfig = backendConfig;
    }

    @Override
    public void setZombieTimeout(Duration zombieTimeout) {
        this.zombieTimeout = requirePositive(zombieTimeout);
    }

    protected BackendConfig getBackendConfig() {
        return backendConfig;
    }

    @Override
    public void markBusy() {
        borrowedAt = clock.instant();
        busy.set(true);
    }

    @Override
    public void markFree() {
        busy.set(false);
        borrowedAt = null;
    }

    @Override
    public boolean isBusy() {
        return busy.get();
    }

    @Override
    public boolean isZombie() {
        Instant since = borrowedAt;
        if (!busy.get() || since == null) {
            return false;
        }
        return Duration.between(since, clock.instant()).compareTo(zombieTimeout) > 0;
    }

    @Override
    public void markSnipped() {
        snipped = true;
    }

    @Override
    public boolean isSnipped() {
        return snipped;
    }

    @Override
    public int getPoolIndex() {
        return poolIndex;
    }

    public Duration getZombieTimeout() {
        return zombieTimeout;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "poolIndex=" + poolIndex +
                ", busy=" + busy.get() +
                ", snipped=" + snipped +
                ", host='" + backendConfig.host() + '\'' +
                ", port=" + backendConfig.port() +
                '}';
    }
}
