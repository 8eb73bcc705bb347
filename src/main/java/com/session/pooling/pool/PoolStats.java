package com.session.pooling.pool;

import com.session.pooling.core.model.PoolHealth;
import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.core.model.PoolStrategy;

/**
 * Point-in-time statistics of a {@link SessionPool}. Derived on demand, never persisted.
 *
 * @param totalSessions       live sessions owned by the pool (active + available + draining)
 * @param activeSessions      sessions currently checked out
 * @param availableSessions   idle sessions ready for acquisition
 * @param drainingSessions    checked-out sessions that die on release
 * @param totalRequests       outcomes reported since creation or last reset
 * @param successfulRequests  successful outcomes
 * @param failedRequests      failed outcomes
 * @param successRate         successful / total, 0 when no requests
 * @param avgResponseTimeMs   mean time a session was held per request
 * @param healthStatus        classification of the recent success rate
 * @param currentStrategy     selection strategy in effect
 * @param status              lifecycle status of the pool
 * @param waitingCallers      callers blocked in acquire
 * @param totalAcquisitions   successful acquisitions
 * @param totalReleases       releases of tracked sessions
 * @param totalTimeouts       acquisitions that timed out
 * @param totalCreated        sessions created through the factory
 * @param totalDestroyed      sessions torn down
 */
public record PoolStats(
        int totalSessions,
        int activeSessions,
        int availableSessions,
        int drainingSessions,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double avgResponseTimeMs,
        PoolHealth healthStatus,
        PoolStrategy currentStrategy,
        PoolStatus status,
        int waitingCallers,
        long totalAcquisitions,
        long totalReleases,
        long totalTimeouts,
        long totalCreated,
        long totalDestroyed
) {

    public static PoolStats empty(PoolStrategy strategy) {
        return new PoolStats(0, 0, 0, 0, 0, 0, 0, 0.0, 0.0,
                PoolHealth.HEALTHY, strategy, PoolStatus.IDLE, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Active sessions over live sessions; 1.0 when callers are waiting on an empty pool.
     */
    public double utilization() {
        int live = activeSessions + availableSessions;
        if (live == 0) {
            return waitingCallers > 0 ? 1.0 : 0.0;
        }
        return (double) activeSessions / live;
    }
}
