package com.session.pooling.core.model;

import java.time.Instant;

/**
 * Read-only view of one session, as listed by administrative callers.
 *
 * @param id           opaque session identifier
 * @param state        current lifecycle state
 * @param requestCount cumulative requests served
 * @param successCount cumulative successful requests
 * @param failureCount cumulative failed requests
 * @param weight       selection weight used by the weighted strategy
 * @param createdAt    creation timestamp
 * @param lastUsedAt   last acquisition or release timestamp
 */
public record SessionSummary(
        String id,
        SessionState state,
        long requestCount,
        long successCount,
        long failureCount,
        double weight,
        Instant createdAt,
        Instant lastUsedAt
) {
}
