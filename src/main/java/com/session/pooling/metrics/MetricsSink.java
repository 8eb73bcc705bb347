package com.session.pooling.metrics;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.pool.PoolStats;

import java.time.Duration;

/**
 * Observability export for session pools.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * Calls are fire-and-forget: pools catch anything a sink throws and never let it
 * block or fail a pool operation.
 */
public interface MetricsSink {

    /**
     * Publishes a stats snapshot for a pool.
     */
    void emit(String target, PoolStats stats);

    void recordAcquisition(String target, Duration waitTime, boolean created);

    void recordAcquireTimeout(String target);

    void recordRelease(String target, Duration responseTime, boolean success);

    /**
     * @param operation {@code create} or {@code destroy}
     */
    void recordFactoryFailure(String target, String operation);

    /**
     * @param reason why sessions were removed, e.g. {@code idle}, {@code age}, {@code closed}, {@code scale_down}
     */
    void recordEviction(String target, String reason, int count);

    void recordStrategyChange(String target, PoolStrategy from, PoolStrategy to);
}
