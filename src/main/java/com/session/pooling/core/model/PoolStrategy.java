package com.session.pooling.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Session selection strategies a pool can run with.
 */
public enum PoolStrategy {
    ROUND_ROBIN("Distributes sessions evenly across all pool slots in circular order. Best for balanced workloads."),
    LEAST_CONNECTIONS("Routes to the session with the fewest requests served. Best for varying request durations."),
    STICKY("Maintains client affinity to specific sessions. Best for stateful sessions."),
    WEIGHTED("Routes by per-session weight scaled by observed success. Best for heterogeneous backends."),
    NONE("No pooling, creates a fresh session per request. Use when pooling overhead exceeds benefits.");

    private final String description;

    PoolStrategy(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Wire name, e.g. {@code least_connections}.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses either the wire name ({@code round_robin}) or the constant name ({@code ROUND_ROBIN}).
     *
     * @throws IllegalArgumentException if the value names no strategy
     */
    @JsonCreator
    public static PoolStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (PoolStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown pool strategy: " + value);
    }
}
