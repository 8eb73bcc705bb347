package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;

/**
 * Recommends a selection strategy from a pool's recent usage.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>unpooled pools stay on {@code NONE}</li>
 *   <li>fewer than {@code minSamples} outcomes: keep the current strategy</li>
 *   <li>strong per-client repeat access: {@code STICKY}</li>
 *   <li>failure rate above the limit: {@code WEIGHTED}</li>
 *   <li>slow or highly variable response times: {@code LEAST_CONNECTIONS}</li>
 *   <li>otherwise {@code ROUND_ROBIN}</li>
 * </ol>
 */
public class StrategyAdvisor {

    private static final int DEFAULT_MIN_SAMPLES = 20;
    private static final double AFFINITY_REPEAT_THRESHOLD = 0.5;
    private static final double FAILURE_RATE_THRESHOLD = 0.1;
    private static final double SLOW_RESPONSE_MS = 1_000.0;
    private static final double HIGH_VARIATION = 0.5;

    private final int minSamples;

    public StrategyAdvisor() {
        this(DEFAULT_MIN_SAMPLES);
    }

    public StrategyAdvisor(int minSamples) {
        if (minSamples < 0) {
            throw new IllegalArgumentException("minSamples must be >= 0");
        }
        this.minSamples = minSamples;
    }

    public Recommendation recommend(PoolStrategy current, UsageProfile profile) {
        if (current == PoolStrategy.NONE) {
            return new Recommendation(PoolStrategy.NONE, "pooling disabled");
        }
        if (profile.sampleSize() < minSamples) {
            return new Recommendation(current,
                    "insufficient data (" + profile.sampleSize() + " of " + minSamples + " samples)");
        }
        if (profile.affinityRepeatRatio() >= AFFINITY_REPEAT_THRESHOLD) {
            return new Recommendation(PoolStrategy.STICKY,
                    String.format("repeat client access %.0f%%", profile.affinityRepeatRatio() * 100));
        }
        double failureRate = 1.0 - profile.successRate();
        if (failureRate > FAILURE_RATE_THRESHOLD) {
            return new Recommendation(PoolStrategy.WEIGHTED,
                    String.format("failure rate %.1f%%", failureRate * 100));
        }
        if (profile.avgResponseTimeMs() > SLOW_RESPONSE_MS) {
            return new Recommendation(PoolStrategy.LEAST_CONNECTIONS,
                    String.format("slow responses (avg %.0fms)", profile.avgResponseTimeMs()));
        }
        if (profile.responseTimeVariation() > HIGH_VARIATION) {
            return new Recommendation(PoolStrategy.LEAST_CONNECTIONS,
                    String.format("response time variation %.2f", profile.responseTimeVariation()));
        }
        return new Recommendation(PoolStrategy.ROUND_ROBIN, "balanced workload");
    }

    /**
     * @param strategy the recommended strategy
     * @param reason   human-readable justification
     */
    public record Recommendation(PoolStrategy strategy, String reason) {
    }
}
