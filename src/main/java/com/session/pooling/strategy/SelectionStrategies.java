package com.session.pooling.strategy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.session.pooling.core.model.PoolStrategy;

import java.time.Duration;

/**
 * Creates strategy instances for the closed set of {@link PoolStrategy} variants.
 */
public final class SelectionStrategies {

    private SelectionStrategies() {
    }

    /**
     * @param type        the strategy variant
     * @param maxIdleTime lifetime of sticky affinity mappings
     * @param ticker      time source for affinity expiry
     */
    public static SelectionStrategy create(PoolStrategy type, Duration maxIdleTime, Ticker ticker) {
        return switch (type) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case STICKY -> new StickyStrategy(maxIdleTime, ticker);
            case WEIGHTED -> new WeightedStrategy();
            case NONE -> new NoPoolingStrategy();
        };
    }
}
