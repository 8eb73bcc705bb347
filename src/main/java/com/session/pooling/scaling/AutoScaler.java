package com.session.pooling.scaling;

import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.pool.PoolStats;
import com.session.pooling.pool.SessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demand-driven sizing of a session pool within {@code [min_size, max_size]}.
 *
 * <p>Utilization is active sessions over live sessions. Above the high-water mark the pool
 * grows by at most {@code maxStep}; below the low-water mark idle sessions are destroyed,
 * again by at most {@code maxStep}. A pool under {@code min_size} is first brought back to it.</p>
 */
public class AutoScaler {
    private static final Logger log = LoggerFactory.getLogger(AutoScaler.class);

    public static final String REASON_SCALE_DOWN = "scale_down";

    private final ScalingPolicy policy;

    public AutoScaler() {
        this(ScalingPolicy.defaults());
    }

    public AutoScaler(ScalingPolicy policy) {
        this.policy = policy;
    }

    public ScalingPolicy getPolicy() {
        return policy;
    }

    /**
     * Decides how a pool with the given stats should be resized. Has no side effects.
     */
    public ScalingDecision decide(PoolStats stats, PoolConfig config) {
        double utilization = stats.utilization();
        if (!config.isPooling() || !config.isAutoScale()) {
            return ScalingDecision.hold(utilization, "auto-scaling disabled");
        }
        if (stats.status() == PoolStatus.DRAINING || stats.status() == PoolStatus.CLOSED) {
            return ScalingDecision.hold(utilization, "pool is " + stats.status().name().toLowerCase());
        }

        int live = stats.activeSessions() + stats.availableSessions();
        int total = stats.totalSessions();
        if (live < config.getMinSize()) {
            int room = config.getMaxSize() - total;
            int delta = Math.min(config.getMinSize() - live, room);
            return delta > 0
                    ? new ScalingDecision(ScalingDecision.Action.GROW, delta, utilization, "below min_size")
                    : ScalingDecision.hold(utilization, "below min_size but at max_size");
        }
        if (utilization > policy.highWaterMark() && total < config.getMaxSize()) {
            int delta = Math.min(policy.maxStep(), config.getMaxSize() - total);
            return new ScalingDecision(ScalingDecision.Action.GROW, delta, utilization,
                    String.format("utilization %.2f above %.2f", utilization, policy.highWaterMark()));
        }
        if (utilization < policy.lowWaterMark() && live > config.getMinSize()) {
            int delta = Math.min(policy.maxStep(),
                    Math.min(live - config.getMinSize(), stats.availableSessions()));
            if (delta > 0) {
                return new ScalingDecision(ScalingDecision.Action.SHRINK, delta, utilization,
                        String.format("utilization %.2f below %.2f", utilization, policy.lowWaterMark()));
            }
        }
        return ScalingDecision.hold(utilization, "within water marks");
    }

    /**
     * Runs one scaling cycle against a pool. Never throws.
     */
    public ScalingDecision runCycle(SessionPool pool) {
        try {
            ScalingDecision decision = decide(pool.getStats(), pool.getConfig());
            switch (decision.action()) {
                case GROW -> {
                    int created = pool.grow(decision.delta());
                    log.info("Scaled pool {} up by {} of {} ({})",
                            pool.getTarget(), created, decision.delta(), decision.reason());
                }
                case SHRINK -> {
                    int removed = pool.shrink(decision.delta(), REASON_SCALE_DOWN);
                    log.info("Scaled pool {} down by {} ({})", pool.getTarget(), removed, decision.reason());
                }
                case HOLD -> log.debug("Pool {} holds size: {}", pool.getTarget(), decision.reason());
            }
            pool.markRebalanced();
            return decision;
        } catch (RuntimeException e) {
            log.error("Auto-scaling of pool {} failed: {}", pool.getTarget(), e.getMessage(), e);
            return ScalingDecision.hold(0.0, "cycle failed: " + e.getMessage());
        }
    }
}
