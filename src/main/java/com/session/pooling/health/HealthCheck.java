package com.session.pooling.health;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named probe reporting the state of one component, typically one session pool.
 *
 * <p>{@link #check()} should report problems as a {@link HealthStatus} rather than throw;
 * callers aggregating several checks go through {@link #checkSafely()}, which turns an
 * escaped exception into DOWN.</p>
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();

    default HealthStatus checkSafely() {
        try {
            HealthStatus status = check();
            return status != null ? status : HealthStatus.down("Health check returned no status");
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check failed: " + e.getMessage());
        }
    }

    /**
     * Adapts a status supplier, e.g. a lambda over some component's state.
     */
    static HealthCheck of(String name, Supplier<HealthStatus> probe) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(probe, "probe is required");
        return new HealthCheck() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public HealthStatus check() {
                return probe.get();
            }
        };
    }
}
