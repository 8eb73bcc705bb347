package com.session.pooling.pool;

import com.session.pooling.core.model.PoolStrategy;

/**
 * Result of a strategy optimization.
 *
 * @param oldStrategy strategy before optimization
 * @param newStrategy strategy after optimization (equal to the old one when nothing changed)
 * @param applied     whether the pool switched strategy
 * @param reason      why the recommended strategy was chosen
 */
public record OptimizationResult(PoolStrategy oldStrategy, PoolStrategy newStrategy, boolean applied, String reason) {
}
