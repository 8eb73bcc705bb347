package com.session.pooling.health;

import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.pool.PoolStats;
import com.session.pooling.pool.SessionPool;

/**
 * Health check for one session pool.
 * Maps the pool's recent success rate to UP, DEGRADED or DOWN; a draining pool is DEGRADED
 * and a closed one DOWN.
 */
public class SessionPoolHealthCheck implements HealthCheck {

    private final SessionPool pool;

    public SessionPoolHealthCheck(SessionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return pool.getTarget();
    }

    @Override
    public HealthStatus check() {
        try {
            PoolStats stats = pool.getStats();
            HealthStatus.Status status = HealthStatus.Status.of(stats.healthStatus());
            String message = switch (stats.healthStatus()) {
                case HEALTHY -> "OK";
                case DEGRADED -> "Success rate below threshold";
                case UNHEALTHY -> "Success rate critically low";
            };
            if (stats.status() == PoolStatus.CLOSED) {
                status = HealthStatus.Status.DOWN;
                message = "Pool closed";
            } else if (stats.status() == PoolStatus.DRAINING) {
                status = status.worst(HealthStatus.Status.DEGRADED);
                message = "Pool draining";
            }

            return new HealthStatus(status, message, null)
                    .withDetail("status", stats.status().name())
                    .withDetail("strategy", stats.currentStrategy().wireName())
                    .withDetail("totalSessions", stats.totalSessions())
                    .withDetail("activeSessions", stats.activeSessions())
                    .withDetail("availableSessions", stats.availableSessions())
                    .withDetail("successRate", stats.successRate())
                    .withDetail("waitingCallers", stats.waitingCallers());
        } catch (Exception e) {
            return HealthStatus.down("Session pool check failed: " + e.getMessage());
        }
    }
}
