package com.directory.pool.health;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks combined into one overall status.
 * The overall status is the worst individual status; each check's result is
 * added as a detail under the check's name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status overall = HealthStatus.Status.UP;
        String message = "OK";
        HealthStatus aggregate = HealthStatus.up();

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            aggregate = aggregate.withDetail(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            HealthStatus.Status worse = overall.worse(result.status());
            if (worse != overall) {
                overall = worse;
                message = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(overall, message, aggregate.details());
    }

    public int size() {
        return checks.size();
    }
}
