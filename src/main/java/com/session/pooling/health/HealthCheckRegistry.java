package com.session.pooling.health;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Named health checks queried together for an aggregate status.
 *
 * <p>Aggregation: any DOWN check makes the whole DOWN; otherwise any DEGRADED check makes it
 * DEGRADED; otherwise UP. Checks are run in name order, and a check that throws counts as DOWN.</p>
 */
public class HealthCheckRegistry {

    private final Map<String, HealthCheck> checks = new ConcurrentSkipListMap<>();

    /**
     * Registers a check, replacing any check of the same name.
     */
    public void register(HealthCheck check) {
        if (check != null) {
            checks.put(check.getName(), check);
        }
    }

    public void unregister(String name) {
        if (name != null) {
            checks.remove(name);
        }
    }

    /**
     * Runs all registered health checks and returns an aggregate status.
     */
    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> checkResults = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks.values()) {
            HealthStatus result = check.checkSafely();
            checkResults.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));

            if (result.status().ordinal() > worstStatus.ordinal()) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, checkResults);
    }

    public int size() {
        return checks.size();
    }
}
