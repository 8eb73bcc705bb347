package com.session.pooling.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.session.pooling.core.model.PoolStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of one session pool.
 *
 * <p>Instances are immutable and always valid: {@link Builder#build()} normalizes
 * (a disabled pool always runs the {@link PoolStrategy#NONE} strategy) and rejects
 * inconsistent values with a {@link ConfigValidationException}.</p>
 *
 * <p>JSON property names are snake_case. The legacy names {@code size},
 * {@code timeout} and {@code idle_timeout_seconds} are accepted on read as aliases of
 * {@code target_size}, {@code acquire_timeout} and {@code max_idle_time}.</p>
 */
@JsonDeserialize(builder = PoolConfig.Builder.class)
@JsonPropertyOrder({"enabled", "strategy", "min_size", "max_size", "target_size", "acquire_timeout",
        "max_idle_time", "max_session_age", "auto_scale", "health_check_threshold",
        "health_check_interval", "rebalance_interval"})
public final class PoolConfig {

    private final boolean enabled;
    private final PoolStrategy strategy;
    private final int minSize;
    private final int maxSize;
    private final int targetSize;
    private final Duration acquireTimeout;
    private final Duration maxIdleTime;
    private final Duration maxSessionAge;
    private final boolean autoScale;
    private final double healthCheckThreshold;
    private final Duration healthCheckInterval;
    private final Duration rebalanceInterval;

    private PoolConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.strategy = builder.strategy;
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.targetSize = builder.targetSize;
        this.acquireTimeout = builder.acquireTimeout;
        this.maxIdleTime = builder.maxIdleTime;
        this.maxSessionAge = builder.maxSessionAge;
        this.autoScale = builder.autoScale;
        this.healthCheckThreshold = builder.healthCheckThreshold;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.rebalanceInterval = builder.rebalanceInterval;
    }

    @JsonProperty("enabled")
    public boolean isEnabled() { return enabled; }

    @JsonProperty("strategy")
    public PoolStrategy getStrategy() { return strategy; }

    @JsonProperty("min_size")
    public int getMinSize() { return minSize; }

    @JsonProperty("max_size")
    public int getMaxSize() { return maxSize; }

    @JsonProperty("target_size")
    public int getTargetSize() { return targetSize; }

    @JsonProperty("acquire_timeout")
    public Duration getAcquireTimeout() { return acquireTimeout; }

    @JsonProperty("max_idle_time")
    public Duration getMaxIdleTime() { return maxIdleTime; }

    /**
     * Sessions older than this are recycled by the health monitor. Zero disables recycling.
     */
    @JsonProperty("max_session_age")
    public Duration getMaxSessionAge() { return maxSessionAge; }

    @JsonProperty("auto_scale")
    public boolean isAutoScale() { return autoScale; }

    @JsonProperty("health_check_threshold")
    public double getHealthCheckThreshold() { return healthCheckThreshold; }

    @JsonProperty("health_check_interval")
    public Duration getHealthCheckInterval() { return healthCheckInterval; }

    @JsonProperty("rebalance_interval")
    public Duration getRebalanceInterval() { return rebalanceInterval; }

    /**
     * Whether sessions are pooled at all. Disabled pools and the {@code NONE} strategy
     * hand out one-shot sessions.
     */
    @JsonIgnore
    public boolean isPooling() {
        return enabled && strategy != PoolStrategy.NONE;
    }

    public PoolConfig withStrategy(PoolStrategy strategy) {
        return toBuilder().strategy(strategy).build();
    }

    public PoolConfig withTargetSize(int targetSize) {
        return toBuilder().targetSize(targetSize).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .strategy(strategy)
                .minSize(minSize)
                .maxSize(maxSize)
                .targetSize(targetSize)
                .acquireTimeout(acquireTimeout)
                .maxIdleTime(maxIdleTime)
                .maxSessionAge(maxSessionAge)
                .autoScale(autoScale)
                .healthCheckThreshold(healthCheckThreshold)
                .healthCheckInterval(healthCheckInterval)
                .rebalanceInterval(rebalanceInterval);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PoolConfig defaults() {
        return builder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PoolConfig that)) return false;
        return enabled == that.enabled
                && minSize == that.minSize
                && maxSize == that.maxSize
                && targetSize == that.targetSize
                && autoScale == that.autoScale
                && Double.compare(that.healthCheckThreshold, healthCheckThreshold) == 0
                && strategy == that.strategy
                && acquireTimeout.equals(that.acquireTimeout)
                && maxIdleTime.equals(that.maxIdleTime)
                && maxSessionAge.equals(that.maxSessionAge)
                && healthCheckInterval.equals(that.healthCheckInterval)
                && rebalanceInterval.equals(that.rebalanceInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, strategy, minSize, maxSize, targetSize, acquireTimeout, maxIdleTime,
                maxSessionAge, autoScale, healthCheckThreshold, healthCheckInterval, rebalanceInterval);
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "enabled=" + enabled +
                ", strategy=" + strategy +
                ", minSize=" + minSize +
                ", maxSize=" + maxSize +
                ", targetSize=" + targetSize +
                ", acquireTimeout=" + acquireTimeout +
                ", maxIdleTime=" + maxIdleTime +
                ", maxSessionAge=" + maxSessionAge +
                ", autoScale=" + autoScale +
                ", healthCheckThreshold=" + healthCheckThreshold +
                ", healthCheckInterval=" + healthCheckInterval +
                ", rebalanceInterval=" + rebalanceInterval +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private boolean enabled = true;
        private PoolStrategy strategy = PoolStrategy.ROUND_ROBIN;
        private int minSize = 1;
        private int maxSize = 10;
        private int targetSize = 2;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration maxIdleTime = Duration.ofMinutes(10);
        private Duration maxSessionAge = Duration.ZERO;
        private boolean autoScale = false;
        private double healthCheckThreshold = 0.8;
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration rebalanceInterval = Duration.ofSeconds(30);

        @JsonProperty("enabled")
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        @JsonProperty("strategy")
        public Builder strategy(PoolStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        @JsonProperty("min_size")
        public Builder minSize(int minSize) {
            this.minSize = minSize;
            return this;
        }

        @JsonProperty("max_size")
        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        @JsonProperty("target_size")
        @JsonAlias("size")
        public Builder targetSize(int targetSize) {
            this.targetSize = targetSize;
            return this;
        }

        @JsonProperty("acquire_timeout")
        @JsonAlias("timeout")
        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        @JsonProperty("max_idle_time")
        @JsonAlias("idle_timeout_seconds")
        public Builder maxIdleTime(Duration maxIdleTime) {
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        @JsonProperty("max_session_age")
        public Builder maxSessionAge(Duration maxSessionAge) {
            this.maxSessionAge = maxSessionAge;
            return this;
        }

        @JsonProperty("auto_scale")
        public Builder autoScale(boolean autoScale) {
            this.autoScale = autoScale;
            return this;
        }

        @JsonProperty("health_check_threshold")
        public Builder healthCheckThreshold(double healthCheckThreshold) {
            this.healthCheckThreshold = healthCheckThreshold;
            return this;
        }

        @JsonProperty("health_check_interval")
        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        @JsonProperty("rebalance_interval")
        public Builder rebalanceInterval(Duration rebalanceInterval) {
            this.rebalanceInterval = rebalanceInterval;
            return this;
        }

        /**
         * Normalizes and validates the configuration.
         *
         * @throws ConfigValidationException listing every violated rule
         */
        public PoolConfig build() {
            if (!enabled || strategy == null) {
                strategy = enabled ? PoolStrategy.ROUND_ROBIN : PoolStrategy.NONE;
            }
            List<String> violations = new ArrayList<>();
            if (minSize < 0) violations.add("min_size must be >= 0");
            if (maxSize < 1) violations.add("max_size must be >= 1");
            if (targetSize < 0) violations.add("target_size must be >= 0");
            if (enabled) {
                if (minSize > maxSize) {
                    violations.add("min_size (" + minSize + ") cannot exceed max_size (" + maxSize + ")");
                }
                if (targetSize < minSize || targetSize > maxSize) {
                    violations.add("target_size (" + targetSize + ") must be within [min_size, max_size] = ["
                            + minSize + ", " + maxSize + "]");
                }
            }
            requirePositive(acquireTimeout, "acquire_timeout", violations);
            requirePositive(maxIdleTime, "max_idle_time", violations);
            requirePositive(healthCheckInterval, "health_check_interval", violations);
            requirePositive(rebalanceInterval, "rebalance_interval", violations);
            if (maxSessionAge == null || maxSessionAge.isNegative()) {
                violations.add("max_session_age must be >= 0");
            }
            if (Double.isNaN(healthCheckThreshold) || healthCheckThreshold < 0.0 || healthCheckThreshold > 1.0) {
                violations.add("health_check_threshold must be within [0, 1]");
            }
            if (!violations.isEmpty()) {
                throw new ConfigValidationException(violations);
            }
            return new PoolConfig(this);
        }

        private static void requirePositive(Duration value, String name, List<String> violations) {
            if (value == null || value.isZero() || value.isNegative()) {
                violations.add(name + " must be > 0");
            }
        }
    }
}
