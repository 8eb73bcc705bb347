package com.session.pooling.metrics;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.pool.PoolStats;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsSink}.
 */
public class NoOpMetricsSink implements MetricsSink {

    @Override
    public void emit(String target, PoolStats stats) {
    }

    @Override
    public void recordAcquisition(String target, Duration waitTime, boolean created) {
    }

    @Override
    public void recordAcquireTimeout(String target) {
    }

    @Override
    public void recordRelease(String target, Duration responseTime, boolean success) {
    }

    @Override
    public void recordFactoryFailure(String target, String operation) {
    }

    @Override
    public void recordEviction(String target, String reason, int count) {
    }

    @Override
    public void recordStrategyChange(String target, PoolStrategy from, PoolStrategy to) {
    }
}
