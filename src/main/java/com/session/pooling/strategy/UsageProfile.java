package com.session.pooling.strategy;

/**
 * Recent usage of a pool, as seen by the {@link StrategyAdvisor}.
 *
 * @param sampleSize            number of release outcomes in the observation window
 * @param successRate           fraction of successful outcomes in the window
 * @param avgResponseTimeMs     mean time sessions were held, in milliseconds
 * @param responseTimeVariation coefficient of variation (stddev / mean) of hold times
 * @param utilization           active sessions divided by live sessions
 * @param affinityRepeatRatio   fraction of keyed acquisitions whose affinity key was seen before
 */
public record UsageProfile(
        long sampleSize,
        double successRate,
        double avgResponseTimeMs,
        double responseTimeVariation,
        double utilization,
        double affinityRepeatRatio
) {
}
