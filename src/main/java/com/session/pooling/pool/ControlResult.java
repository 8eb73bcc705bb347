package com.session.pooling.pool;

import java.util.List;

/**
 * Outcome of an administrative control operation.
 *
 * @param target              the pool's backend target
 * @param operation           {@code drain}, {@code resize}, {@code reset} or {@code reconfigure}
 * @param message             human-readable confirmation
 * @param affectedSessionIds  sessions destroyed, created or marked draining by the operation
 * @param failures            steps that could not complete, e.g. {@code destroy <id>: <error>}
 * @param stats               pool statistics after the operation
 */
public record ControlResult(
        String target,
        String operation,
        String message,
        List<String> affectedSessionIds,
        List<String> failures,
        PoolStats stats
) {
    public ControlResult {
        affectedSessionIds = List.copyOf(affectedSessionIds);
        failures = List.copyOf(failures);
    }

    /**
     * Whether every step of the operation completed.
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }
}
