package com.directory.pool.pool;

import com.directory.pool.connection.BackendConfig;
import com.directory.pool.connection.ConnectResult;
import com.directory.pool.connection.DirectoryConnection;
import com.directory.pool.connection.DirectoryConnectionFactory;
import com.directory.pool.connection.DirectoryEnvironment;
import com.directory.pool.connection.LdapDirectoryConnection;
import com.directory.pool.logging.LogContext;
import com.directory.pool.metrics.NoOpPoolMetrics;
import com.directory.pool.metrics.PoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection pool built on an index-addressed slot array and a {@link BitSet}
 * recording which slots are borrowed.
 *
 * <p>A single {@link ReentrantLock} guards the slots, the busy bits, the capacity and
 * the current configuration. It is held for the whole of {@link #borrow},
 * {@link #reconfigure} and {@link #zombieControl}, and for the slot-clearing step of
 * {@link #release}. Connect calls made while borrowing or warm-starting run under
 * the lock, so a slow backend serialises pool operations; each connect is bounded
 * by the connection's own timeout.</p>
 *
 * <p>Borrowing never waits: when every slot is busy an empty result is returned and
 * a zombie sweep is dispatched on the sweeper executor. Shrinking the pool marks the
 * removed connections as snipped; a borrower holding one keeps using it and the
 * connection is closed when released.</p>
 */
public class SlotConnectionPool implements DirectoryConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SlotConnectionPool.class);

    static final double ZOMBIE_CONTROL_OCCUPANCY = 0.9;

    private final ReentrantLock poolLock = new ReentrantLock();
    private final String name;
    private final DirectoryConnectionFactory connectionFactory;
    private final PoolMetrics metrics;
    private final Executor sweepExecutor;
    private final ExecutorService ownedExecutor;

    // Guarded by poolLock
    private DirectoryConnection[] slots;
    private final BitSet busy = new BitSet();
    private int capacity;
    private int warmStartCount;
    private PoolConfig config;
    private boolean closed;

    private volatile GroupRoleMapping groupRoleMapping = GroupRoleMapping.empty();

    private final AtomicLong totalBorrowed = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalExhausted = new AtomicLong(0);
    private final AtomicLong totalZombiesReclaimed = new AtomicLong(0);

    public SlotConnectionPool(PoolConfig config) {
        this(config, LdapDirectoryConnection.factory(config.getZombieTimeout(), config.getConnectTimeout()),
                new NoOpPoolMetrics());
    }

    public SlotConnectionPool(PoolConfig config, DirectoryConnectionFactory connectionFactory,
                              PoolMetrics metrics) {
        this(config, connectionFactory, metrics, null);
    }

    /**
     * @param sweepExecutor executor running asynchronous zombie sweeps; when null the pool
     *                      creates and owns a daemon executor that is shut down on close
     */
    public SlotConnectionPool(PoolConfig config, DirectoryConnectionFactory connectionFactory,
                              PoolMetrics metrics, Executor sweepExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.metrics = metrics != null ? metrics : new NoOpPoolMetrics();
        this.name = config.getName();
        if (sweepExecutor != null) {
            this.ownedExecutor = null;
            this.sweepExecutor = sweepExecutor;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(sweeperThreadFactory(name));
            this.sweepExecutor = ownedExecutor;
        }

        DirectoryEnvironment.initialize(config.getCaPath());

        poolLock.lock();
        try {
            capacity = config.getMaxSize();
            warmStartCount = config.getInitialSize();
            BackendConfig backend = config.toBackendConfig();
            slots = new DirectoryConnection[capacity];
            for (int i = 0; i < capacity; i++) {
                slots[i] = connectionFactory.create(i, backend);
                if (i < warmStartCount) {
                    ConnectResult result = connect(slots[i]);
                    if (!result.isSuccess()) {
                        log.warn("Failed to pre-connect connection {}/{}: {}",
                                i + 1, warmStartCount, result.response());
                    }
                }
            }
        } finally {
            poolLock.unlock();
        }

        this.metrics.recordCapacity(capacity);
        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public Optional<DirectoryConnection> borrow(boolean connect) {
        DirectoryConnection connection = null;
        boolean exhausted = false;

        poolLock.lock();
        try {
            if (closed) {
                log.debug("Borrow on closed pool '{}'", name);
                return Optional.empty();
            }

            int idx = findFirstFree();
            if (idx == -1) {
                exhausted = true;
            } else {
                busy.set(idx);
                connection = slots[idx];
                if (connect) {
                    ConnectResult result = connect(connection);
                    if (!result.isSuccess()) {
                        log.error("Connection to directory backend failed (slot {}): {}", idx, result.response());
                        busy.clear(idx);
                        connection = null;
                        metrics.recordConnectFailure();
                    }
                }
                if (connection != null) {
                    connection.markBusy();
                }
            }
        } finally {
            poolLock.unlock();
        }

        if (exhausted) {
            log.warn("No available connections in pool '{}'", name);
            totalExhausted.incrementAndGet();
            metrics.recordExhausted();
            scheduleZombieControl();
            return Optional.empty();
        }

        if (connection != null) {
            totalBorrowed.incrementAndGet();
            metrics.recordBorrowed();
            log.debug("Connection {} borrowed from pool '{}'", connection.getPoolIndex(), name);
        }
        return Optional.ofNullable(connection);
    }

    @Override
    public void release(DirectoryConnection connection) {
        if (connection == null) {
            return;
        }

        connection.markFree();

        if (connection.isSnipped()) {
            countRelease();
            discard(connection);
            return;
        }

        boolean snipped = false;
        boolean cleared = false;
        int inUse;
        int currentCapacity;
        poolLock.lock();
        try {
            int idx = connection.getPoolIndex();
            // A shrink may have happened since the borrow
            if (connection.isSnipped()) {
                snipped = true;
            } else if (idx >= 0 && idx < capacity && slots[idx] == connection) {
                busy.clear(idx);
                cleared = true;
            } else {
                log.debug("Ignoring release of connection {} not owned by pool '{}'", idx, name);
            }
            inUse = busy.cardinality();
            currentCapacity = capacity;
        } finally {
            poolLock.unlock();
        }

        if (snipped) {
            countRelease();
            discard(connection);
            return;
        }
        if (!cleared) {
            return;
        }

        countRelease();
        log.debug("Connection {} released to pool '{}' (inUse={})", connection.getPoolIndex(), name, inUse);
        if (currentCapacity > 0 && inUse >= Math.ceil(currentCapacity * ZOMBIE_CONTROL_OCCUPANCY)) {
            scheduleZombieControl();
        }
    }

    @Override
    public void reconfigure(PoolConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        zombieControl();

        try (LogContext ctx = LogContext.forReconfigure(name, newConfig.getMaxSize())) {
            log.debug("Reconfiguring pool '{}': {}", name, newConfig);

            int removed = 0;
            int failures = 0;
            int newCapacity = newConfig.getMaxSize();
            poolLock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException("Pool is closed");
                }

                int oldCapacity = capacity;
                BackendConfig backend = newConfig.toBackendConfig();

                if (newCapacity < oldCapacity) {
                    log.debug("Reducing max pool size from {} to {}", oldCapacity, newCapacity);
                    for (int i = newCapacity; i < oldCapacity; i++) {
                        DirectoryConnection removedConnection = slots[i];
                        removedConnection.markSnipped();
                        if (!busy.get(i)) {
                            closeQuietly(removedConnection);
                        }
                        removed++;
                    }
                    busy.clear(newCapacity, oldCapacity);
                    slots = Arrays.copyOf(slots, newCapacity);
                } else if (newCapacity > oldCapacity) {
                    log.debug("Extending max pool size from {} to {}", oldCapacity, newCapacity);
                    slots = Arrays.copyOf(slots, newCapacity);
                    for (int i = oldCapacity; i < newCapacity; i++) {
                        slots[i] = connectionFactory.create(i, backend);
                    }
                }

                capacity = newCapacity;
                warmStartCount = newConfig.getInitialSize();
                config = newConfig;

                int surviving = Math.min(oldCapacity, newCapacity);
                for (int i = 0; i < surviving; i++) {
                    slots[i].configure(backend);
                }
                // Grown slots come from the factory with its own timeout
                for (int i = 0; i < newCapacity; i++) {
                    slots[i].setZombieTimeout(newConfig.getZombieTimeout());
                }

                // One connect per warm slot, whether it survived or was just created
                for (int i = 0; i < warmStartCount; i++) {
                    ConnectResult result = connect(slots[i]);
                    if (!result.isSuccess()) {
                        failures++;
                        log.warn("Reconnect of connection {} failed: {}", i, result.response());
                    }
                }
            } finally {
                poolLock.unlock();
            }

            metrics.recordSnipped(removed);
            metrics.recordReconfigured();
            metrics.recordCapacity(newCapacity);
            log.info("Pool '{}' reconfigured: capacity={}, warmStart={}, snipped={}, connectFailures={}",
                    name, newCapacity, newConfig.getInitialSize(), removed, failures);
        }
    }

    @Override
    public int zombieControl() {
        int reclaimed = 0;
        try (LogContext ctx = LogContext.forZombieControl(name)) {
            poolLock.lock();
            try {
                for (int i = busy.nextSetBit(0); i >= 0 && i < capacity; i = busy.nextSetBit(i + 1)) {
                    DirectoryConnection connection = slots[i];
                    if (isZombie(connection)) {
                        connection.markFree();
                        busy.clear(i);
                        reclaimed++;
                    }
                }
            } finally {
                poolLock.unlock();
            }

            if (reclaimed > 0) {
                totalZombiesReclaimed.addAndGet(reclaimed);
                metrics.recordZombiesReclaimed(reclaimed);
                log.info("Reclaimed {} zombie connection(s) in pool '{}'", reclaimed, name);
            } else {
                log.debug("No zombie connections in pool '{}'", name);
            }
        }
        return reclaimed;
    }

    @Override
    public void resetGroupRoleMapping(String mapping) {
        groupRoleMapping = GroupRoleMapping.parse(mapping);
        log.debug("Group role mapping reset: {}", groupRoleMapping);
    }

    @Override
    public Map<String, String> getGroupRoleMapping() {
        return groupRoleMapping.asMap();
    }

    /**
     * Returns the parsed group to role mapping.
     */
    public GroupRoleMapping groupRoleMapping() {
        return groupRoleMapping;
    }

    @Override
    public PoolStats getStats() {
        poolLock.lock();
        try {
            int inUse = busy.cardinality();
            return new PoolStats(
                    capacity,
                    warmStartCount,
                    inUse,
                    capacity - inUse,
                    totalBorrowed.get(),
                    totalReleased.get(),
                    totalExhausted.get(),
                    totalZombiesReclaimed.get()
            );
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Logs the pool sizing and usage at debug level.
     */
    public void debugInfo() {
        PoolStats stats = getStats();
        log.debug("conn_init [{}] conn_max [{}] conn_in_use [{}]",
                stats.warmStartCount(), stats.capacity(), stats.busyConnections());
    }

    /**
     * Returns the configuration currently in effect.
     */
    public PoolConfig getConfig() {
        poolLock.lock();
        try {
            return config;
        } finally {
            poolLock.unlock();
        }
    }

    boolean isSlotBusy(int idx) {
        poolLock.lock();
        try {
            return idx >= 0 && idx < capacity && busy.get(idx);
        } finally {
            poolLock.unlock();
        }
    }

    @Override
    public void close() {
        List<DirectoryConnection> toClose = new ArrayList<>();
        poolLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            log.info("Closing connection pool '{}'...", name);
            for (int i = 0; i < capacity; i++) {
                if (busy.get(i)) {
                    // Closed by the borrower on release
                    slots[i].markSnipped();
                } else {
                    toClose.add(slots[i]);
                }
            }
            slots = new DirectoryConnection[0];
            busy.clear();
            capacity = 0;
        } finally {
            poolLock.unlock();
        }

        toClose.forEach(this::closeQuietly);
        shutdownSweeper();
        log.info("Connection pool '{}' closed", name);
    }

    // Requires holding the lock
    private int findFirstFree() {
        // Everything in use, fast exit
        if (busy.cardinality() >= capacity) {
            return -1;
        }
        int idx = busy.nextClearBit(0);
        return idx < capacity ? idx : -1;
    }

    // Requires holding the lock
    private ConnectResult connect(DirectoryConnection connection) {
        try {
            return connection.connect(config.getBindDn(), config.getBindPassword());
        } catch (RuntimeException e) {
            log.warn("Connection {} threw during connect", connection.getPoolIndex(), e);
            return ConnectResult.failure(e.getMessage());
        }
    }

    private boolean isZombie(DirectoryConnection connection) {
        try {
            return connection.isZombie();
        } catch (RuntimeException e) {
            log.warn("Zombie check failed for connection {}: {}", connection.getPoolIndex(), e.getMessage());
            return false;
        }
    }

    private void scheduleZombieControl() {
        try {
            sweepExecutor.execute(this::zombieControl);
        } catch (RejectedExecutionException e) {
            log.debug("Zombie control not scheduled for pool '{}': {}", name, e.getMessage());
        }
    }

    private void countRelease() {
        totalReleased.incrementAndGet();
        metrics.recordReleased();
    }

    private void discard(DirectoryConnection connection) {
        log.debug("Discarding snipped connection {}", connection.getPoolIndex());
        closeQuietly(connection);
    }

    private void closeQuietly(DirectoryConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection {}: {}", connection.getPoolIndex(), e.getMessage());
        }
    }

    private void shutdownSweeper() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory sweeperThreadFactory(String poolName) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "directory-pool-" + poolName + "-sweeper-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
