package com.session.pooling.metrics;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.pool.PoolStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer-based implementation of {@link MetricsSink}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code session.pool.sessions} -- Gauge (tags: target, state = total|active|available|draining)</li>
 *   <li>{@code session.pool.success.rate} -- Gauge (tag: target)</li>
 *   <li>{@code session.pool.acquire.wait} -- Timer (tags: target, source = reused|created)</li>
 *   <li>{@code session.pool.response.time} -- Timer (tags: target, outcome = success|failure)</li>
 *   <li>{@code session.pool.acquire.timeout} -- Counter (tag: target)</li>
 *   <li>{@code session.pool.factory.failure} -- Counter (tags: target, operation)</li>
 *   <li>{@code session.pool.evicted} -- Counter (tags: target, reason)</li>
 *   <li>{@code session.pool.strategy.change} -- Counter (tags: target, from, to)</li>
 * </ul>
 */
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry registry;
    private final Map<String, AtomicReference<PoolStats>> latestStats = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void emit(String target, PoolStats stats) {
        latestStats.computeIfAbsent(target, this::registerGauges).set(stats);
    }

    @Override
    public void recordAcquisition(String target, Duration waitTime, boolean created) {
        String source = created ? "created" : "reused";
        timer("session.pool.acquire.wait", "Time spent waiting for a session", target, "source", source)
                .record(waitTime);
    }

    @Override
    public void recordAcquireTimeout(String target) {
        counter("session.pool.acquire.timeout", "Acquisitions that timed out", target, null, null)
                .increment();
    }

    @Override
    public void recordRelease(String target, Duration responseTime, boolean success) {
        timer("session.pool.response.time", "Time a session was held by a request", target,
                "outcome", success ? "success" : "failure")
                .record(responseTime);
    }

    @Override
    public void recordFactoryFailure(String target, String operation) {
        counter("session.pool.factory.failure", "Backend session create/destroy failures", target,
                "operation", operation)
                .increment();
    }

    @Override
    public void recordEviction(String target, String reason, int count) {
        counter("session.pool.evicted", "Sessions removed by health checks and scaling", target,
                "reason", reason)
                .increment(count);
    }

    @Override
    public void recordStrategyChange(String target, PoolStrategy from, PoolStrategy to) {
        String key = "strategy:" + target + ":" + from + ":" + to;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("session.pool.strategy.change")
                        .description("Selection strategy switches")
                        .tag("target", target)
                        .tag("from", from.wireName())
                        .tag("to", to.wireName())
                        .register(registry))
                .increment();
    }

    private AtomicReference<PoolStats> registerGauges(String target) {
        AtomicReference<PoolStats> holder = new AtomicReference<>(PoolStats.empty(PoolStrategy.NONE));
        gauge(target, holder, "total", PoolStats::totalSessions);
        gauge(target, holder, "active", PoolStats::activeSessions);
        gauge(target, holder, "available", PoolStats::availableSessions);
        gauge(target, holder, "draining", PoolStats::drainingSessions);
        Gauge.builder("session.pool.success.rate", holder, h -> h.get().successRate())
                .description("Fraction of successful requests")
                .tag("target", target)
                .register(registry);
        return holder;
    }

    private void gauge(String target, AtomicReference<PoolStats> holder, String state,
                       ToDoubleFunction<PoolStats> value) {
        Gauge.builder("session.pool.sessions", holder, h -> value.applyAsDouble(h.get()))
                .description("Sessions in the pool by state")
                .tag("target", target)
                .tag("state", state)
                .register(registry);
    }

    private Timer timer(String name, String description, String target, String tagKey, String tagValue) {
        String key = name + ":" + target + ":" + tagValue;
        return timerCache.computeIfAbsent(key, k ->
                Timer.builder(name)
                        .description(description)
                        .tag("target", target)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private Counter counter(String name, String description, String target, String tagKey, String tagValue) {
        String key = name + ":" + target + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(name)
                    .description(description)
                    .tag("target", target);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(registry);
        });
    }
}
