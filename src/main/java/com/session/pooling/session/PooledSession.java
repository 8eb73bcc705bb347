package com.session.pooling.session;

import com.session.pooling.core.model.ReleaseOutcome;
import com.session.pooling.core.model.SessionState;
import com.session.pooling.core.model.SessionSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A backend session together with its runtime state.
 *
 * <p>Identity and handle are immutable. Mutable state is only changed by the owning pool
 * while it holds its structural lock; callers use {@link #handle()} between acquire and release.</p>
 */
public final class PooledSession {

    private final String id;
    private final long sequence;
    private final String target;
    private final SessionHandle handle;
    private final Instant createdAt;
    private final boolean pooled;

    private volatile SessionState state;
    private volatile Instant lastUsedAt;
    private Instant checkedOutAt;
    private long requestCount;
    private long successCount;
    private long failureCount;
    private double weight = 1.0;

    public PooledSession(long sequence, String target, SessionHandle handle, Instant createdAt, boolean pooled) {
        this.id = UUID.randomUUID().toString().replace("-", "");
        this.sequence = sequence;
        this.target = Objects.requireNonNull(target, "target is required");
        this.handle = Objects.requireNonNull(handle, "handle is required");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
        this.pooled = pooled;
        this.state = SessionState.AVAILABLE;
        this.lastUsedAt = createdAt;
    }

    public String id() { return id; }
    public long sequence() { return sequence; }
    public String target() { return target; }
    public SessionHandle handle() { return handle; }
    public Instant createdAt() { return createdAt; }
    public SessionState state() { return state; }
    public Instant lastUsedAt() { return lastUsedAt; }
    public long requestCount() { return requestCount; }
    public long successCount() { return successCount; }
    public long failureCount() { return failureCount; }
    public double weight() { return weight; }

    /**
     * Whether the session belongs to a pool. One-shot sessions handed out by
     * an unpooled pool are destroyed on release.
     */
    public boolean isPooled() {
        return pooled;
    }

    public void setWeight(double weight) {
        if (weight <= 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be a positive number");
        }
        this.weight = weight;
    }

    public void checkOut(Instant now) {
        state = SessionState.ACTIVE;
        checkedOutAt = now;
        lastUsedAt = now;
    }

    /**
     * Records the outcome of the request served since the last check-out.
     *
     * @return time the session was held by the caller
     */
    public Duration recordOutcome(ReleaseOutcome outcome, Instant now) {
        requestCount++;
        if (outcome.successful()) {
            successCount++;
        } else {
            failureCount++;
        }
        Duration held = checkedOutAt != null ? Duration.between(checkedOutAt, now) : Duration.ZERO;
        checkedOutAt = null;
        lastUsedAt = now;
        return held.isNegative() ? Duration.ZERO : held;
    }

    public void markAvailable() {
        state = SessionState.AVAILABLE;
    }

    public void markDraining() {
        state = SessionState.DRAINING;
    }

    public void markDead() {
        state = SessionState.DEAD;
    }

    public Duration idleTime(Instant now) {
        return Duration.between(lastUsedAt, now);
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * Fraction of successful requests, with one virtual success so fresh sessions start at 1.0.
     */
    public double successRatio() {
        return (successCount + 1.0) / (requestCount + 1.0);
    }

    public SessionSummary summary() {
        return new SessionSummary(id, state, requestCount, successCount, failureCount,
                weight, createdAt, lastUsedAt);
    }

    @Override
    public String toString() {
        return "PooledSession{" +
                "id='" + id + '\'' +
                ", target='" + target + '\'' +
                ", state=" + state +
                ", requests=" + requestCount +
                '}';
    }
}
