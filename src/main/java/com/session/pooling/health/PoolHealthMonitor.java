package com.session.pooling.health;

import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.PoolHealth;
import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.pool.PoolStats;
import com.session.pooling.pool.SessionPool;
import com.session.pooling.session.PooledSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic health cycle of a session pool.
 *
 * <p>Each cycle classifies the pool's recent success rate, evicts idle sessions that are
 * expired, too old or no longer open, and, unless the auto-scaler owns sizing, creates
 * replacements up to {@code min_size}. Creation failures are absorbed; the pool stays short
 * until the next cycle.</p>
 */
public class PoolHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(PoolHealthMonitor.class);

    public static final String REASON_IDLE = "idle";
    public static final String REASON_AGE = "age";
    public static final String REASON_CLOSED = "closed";

    /**
     * Runs one health cycle. Never throws.
     *
     * @return the outcome of the cycle
     */
    public CycleReport runCycle(SessionPool pool) {
        try {
            return doRunCycle(pool);
        } catch (RuntimeException e) {
            log.error("Health check of pool {} failed: {}", pool.getTarget(), e.getMessage(), e);
            return new CycleReport(PoolHealth.HEALTHY, 0, 0, 0, 0);
        }
    }

    private CycleReport doRunCycle(SessionPool pool) {
        SessionPool.HealthTransition transition = pool.evaluateHealth();
        if (transition.changed()) {
            if (transition.current() == PoolHealth.HEALTHY) {
                log.info("Pool {} recovered: {} -> {}", pool.getTarget(), transition.previous(), transition.current());
            } else {
                log.warn("Pool {} health changed: {} -> {}", pool.getTarget(), transition.previous(), transition.current());
            }
        }

        PoolStatus status = pool.getStatus();
        if (status == PoolStatus.CLOSED || status == PoolStatus.DRAINING) {
            pool.emitStats();
            return new CycleReport(transition.current(), 0, 0, 0, 0);
        }

        PoolConfig config = pool.getConfig();
        Clock clock = pool.getClock();
        Instant now = clock.instant();
        List<PooledSession> expired = new ArrayList<>();
        List<PooledSession> aged = new ArrayList<>();
        List<PooledSession> closed = new ArrayList<>();
        Map<PooledSession, Instant> probedAt = new IdentityHashMap<>();
        for (PooledSession session : pool.availableSessions()) {
            if (isExpired(session, now, config)) {
                expired.add(session);
            } else if (isAged(session, now, config)) {
                aged.add(session);
            } else {
                Instant lastUsed = session.lastUsedAt();
                if (!isOpen(session)) {
                    closed.add(session);
                    probedAt.put(session, lastUsed);
                }
            }
        }

        // sessions used after the snapshot above are kept
        int idleEvicted = pool.retire(expired, s -> isExpired(s, clock.instant(), config), REASON_IDLE);
        int ageEvicted = pool.retire(aged, s -> isAged(s, clock.instant(), config), REASON_AGE);
        int closedEvicted = pool.retire(closed, s -> s.lastUsedAt().equals(probedAt.get(s)), REASON_CLOSED);
        if (closedEvicted > 0) {
            log.warn("Evicted {} closed sessions from pool {}", closedEvicted, pool.getTarget());
        }
        if (idleEvicted + ageEvicted > 0) {
            log.info("Evicted {} idle and {} aged sessions from pool {}", idleEvicted, ageEvicted, pool.getTarget());
        }

        int replaced = 0;
        if (config.isPooling() && !config.isAutoScale()) {
            PoolStats stats = pool.getStats();
            int live = stats.activeSessions() + stats.availableSessions();
            int missing = config.getMinSize() - live;
            if (missing > 0) {
                replaced = pool.grow(missing);
                log.debug("Replenished pool {} with {} of {} missing sessions", pool.getTarget(), replaced, missing);
            }
        }

        pool.emitStats();
        return new CycleReport(transition.current(), idleEvicted, ageEvicted, closedEvicted, replaced);
    }

    private static boolean isExpired(PooledSession session, Instant now, PoolConfig config) {
        return session.idleTime(now).compareTo(config.getMaxIdleTime()) > 0;
    }

    private static boolean isAged(PooledSession session, Instant now, PoolConfig config) {
        return !config.getMaxSessionAge().isZero()
                && session.age(now).compareTo(config.getMaxSessionAge()) > 0;
    }

    private boolean isOpen(PooledSession session) {
        try {
            return session.handle().isOpen();
        } catch (RuntimeException e) {
            log.debug("Liveness probe of session {} failed: {}", session.id(), e.getMessage());
            return false;
        }
    }

    public record CycleReport(PoolHealth health, int idleEvicted, int ageEvicted, int closedEvicted, int replaced) {
        public int totalEvicted() {
            return idleEvicted + ageEvicted + closedEvicted;
        }
    }
}
