package com.directory.pool.health;

import com.directory.pool.pool.PoolStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a {@link HealthCheck}. Details keep insertion order so that pool
 * figures are reported in a stable layout.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        public Status worse(Status other) {
            return other != null && other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return of(Status.UP, "OK");
    }

    public static HealthStatus up(String message) {
        return of(Status.UP, message);
    }

    public static HealthStatus degraded(String reason) {
        return of(Status.DEGRADED, reason);
    }

    public static HealthStatus down(String reason) {
        return of(Status.DOWN, reason);
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    /**
     * Adds the slot figures of a pool snapshot, occupancy as a whole percentage.
     */
    public HealthStatus withPoolStats(PoolStats stats) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put("capacity", stats.capacity());
        merged.put("warmStartCount", stats.warmStartCount());
        merged.put("busyConnections", stats.busyConnections());
        merged.put("freeConnections", stats.freeConnections());
        merged.put("occupancyPercent", Math.round(stats.occupancy() * 100));
        merged.put("totalExhausted", stats.totalExhausted());
        merged.put("totalZombiesReclaimed", stats.totalZombiesReclaimed());
        return new HealthStatus(status, message, merged);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
