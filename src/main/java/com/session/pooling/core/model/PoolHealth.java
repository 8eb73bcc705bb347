package com.session.pooling.core.model;

/**
 * Health classification of a pool derived from its recent success rate.
 * Declared from best to worst so that ordinal comparison yields the worse status.
 */
public enum PoolHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /**
     * Classifies a success rate against a pool's health threshold.
     * Below half the threshold is {@link #UNHEALTHY}, below the threshold is {@link #DEGRADED}.
     */
    public static PoolHealth classify(double successRate, double threshold) {
        if (successRate < threshold / 2.0) {
            return UNHEALTHY;
        }
        if (successRate < threshold) {
            return DEGRADED;
        }
        return HEALTHY;
    }

    public PoolHealth worst(PoolHealth other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
