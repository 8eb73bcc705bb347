package com.session.pooling.pool;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.session.pooling.config.ConfigValidationException;
import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.PoolHealth;
import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.core.model.ReleaseOutcome;
import com.session.pooling.core.model.SessionSummary;
import com.session.pooling.logging.LogContext;
import com.session.pooling.metrics.MetricsSink;
import com.session.pooling.session.PooledSession;
import com.session.pooling.session.SessionFactory;
import com.session.pooling.session.SessionFactoryException;
import com.session.pooling.session.SessionHandle;
import com.session.pooling.strategy.SelectionStrategies;
import com.session.pooling.strategy.SelectionStrategy;
import com.session.pooling.strategy.StrategyAdvisor;
import com.session.pooling.strategy.UsageProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded pool of long-lived backend sessions for one target.
 *
 * <p>Every structural change (adding, removing or moving a session between states) happens
 * under one {@link ReentrantLock}. Each session is tracked in exactly one of the
 * {@code available}, {@code active} or {@code draining} maps. Factory calls, session teardown
 * and metrics export always run after the lock is released.</p>
 *
 * <p>Callers blocked in {@link #acquire} queue in arrival order. A released session is
 * handed directly to the longest waiting caller; when capacity frees up instead, that caller
 * is granted a creation slot. A caller that times out or is interrupted leaves the queue
 * without holding anything.</p>
 */
public class SessionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private static final int OUTCOME_WINDOW_SIZE = 100;
    private static final long MAX_TRACKED_AFFINITY_KEYS = 10_000;
    private static final Duration MAX_WAIT = Duration.ofNanos(Long.MAX_VALUE);

    private final String target;
    private final SessionFactory factory;
    private final MetricsSink metrics;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PooledSession> available = new LinkedHashMap<>();
    private final Map<String, PooledSession> active = new HashMap<>();
    private final Map<String, PooledSession> draining = new HashMap<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final OutcomeWindow window = new OutcomeWindow(OUTCOME_WINDOW_SIZE);
    private final Ticker ticker;
    private Cache<String, Boolean> seenAffinityKeys;

    private volatile PoolConfig config;
    private SelectionStrategy strategy;
    private PoolStatus status = PoolStatus.IDLE;
    private int pendingCreations;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long totalResponseNanos;
    private long totalAcquisitions;
    private long totalReleases;
    private long totalTimeouts;
    private long totalCreated;
    private long totalDestroyed;
    private long affinityRequests;
    private long affinityRepeats;

    private PoolHealth lastHealth = PoolHealth.HEALTHY;
    private Instant lastHealthCheck;
    private Instant lastRebalance;

    private ScheduledExecutorService scheduler;
    private Consumer<SessionPool> healthCycle;
    private Consumer<SessionPool> rebalanceCycle;
    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> rebalanceTask;

    public SessionPool(String target, PoolConfig config, SessionFactory factory, MetricsSink metrics) {
        this(target, config, factory, metrics, Clock.systemUTC());
    }

    public SessionPool(String target, PoolConfig config, SessionFactory factory, MetricsSink metrics, Clock clock) {
        this.target = Objects.requireNonNull(target, "target is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.factory = Objects.requireNonNull(factory, "factory is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.ticker = clockTicker(clock);
        this.strategy = SelectionStrategies.create(config.getStrategy(), config.getMaxIdleTime(), ticker);
        this.seenAffinityKeys = affinityKeyCache(config.getMaxIdleTime());
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    private Cache<String, Boolean> affinityKeyCache(Duration ttl) {
        return Caffeine.newBuilder()
                .maximumSize(MAX_TRACKED_AFFINITY_KEYS)
                .expireAfterAccess(ttl)
                .ticker(ticker)
                .build();
    }

    public String getTarget() {
        return target;
    }

    public PoolConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public PoolStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public PoolStrategy getStrategy() {
        lock.lock();
        try {
            return strategy.type();
        } finally {
            lock.unlock();
        }
    }

    // ========== Lifecycle ==========

    /**
     * Warms the pool up to {@code target_size} without background maintenance.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        int toCreate;
        lock.lock();
        try {
            if (status == PoolStatus.CLOSED) {
                return;
            }
            status = PoolStatus.WARMING;
            toCreate = reserveCreationsLocked(config.isPooling() ? config.getTargetSize() - liveCountLocked() : 0);
        } finally {
            lock.unlock();
        }
        log.info("Warming up pool for target {} with {} sessions", target, toCreate);
        List<String> created = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        createIntoPool(toCreate, created, failures);
        lock.lock();
        try {
            if (status == PoolStatus.WARMING) {
                status = PoolStatus.ACTIVE;
            }
        } finally {
            lock.unlock();
        }
        if (!failures.isEmpty()) {
            log.warn("Pool for target {} started short of target size: {} of {} sessions created",
                    target, created.size(), toCreate);
        }
        log.info("Pool for target {} is active with {} sessions", target, created.size());
    }

    /**
     * Warms the pool up and schedules its health and rebalance cycles.
     *
     * @param scheduler      executor running the periodic tasks
     * @param healthCycle    invoked every {@code health_check_interval}
     * @param rebalanceCycle invoked every {@code rebalance_interval}
     */
    public void start(ScheduledExecutorService scheduler,
                      Consumer<SessionPool> healthCycle,
                      Consumer<SessionPool> rebalanceCycle) {
        lock.lock();
        try {
            this.scheduler = scheduler;
            this.healthCycle = healthCycle;
            this.rebalanceCycle = rebalanceCycle;
        } finally {
            lock.unlock();
        }
        start();
        scheduleMaintenance();
    }

    /**
     * Cancels maintenance, fails every waiting caller and tears every session down.
     */
    @Override
    public void close() {
        cancelMaintenance();
        List<PooledSession> doomed;
        lock.lock();
        try {
            if (status == PoolStatus.CLOSED) {
                return;
            }
            status = PoolStatus.CLOSED;
            doomed = removeAllLocked();
            failWaitersLocked(() -> new PoolDrainingException(target, "Pool for '" + target + "' is closed"));
        } finally {
            lock.unlock();
        }
        List<String> failures = new ArrayList<>();
        destroyAll(doomed, failures);
        log.info("Pool for target {} closed: {} sessions destroyed, {} teardown failures",
                target, doomed.size(), failures.size());
    }

    // ========== Acquire / release ==========

    public PooledSession acquire() {
        return acquire(null);
    }

    public PooledSession acquire(String affinityKey) {
        return acquire(affinityKey, null);
    }

    /**
     * Acquires a session, blocking while the pool is at {@code max_size} and none is available.
     *
     * @param affinityKey optional client correlation key used by the sticky strategy
     * @param maxWait     optional caller deadline; the effective wait is the shorter of this
     *                    and {@code acquire_timeout}
     * @return a session checked out to the caller, to be returned with {@link #release}
     * @throws AcquireTimeoutException      if no session became available in time
     * @throws PoolDrainingException        if the pool is draining or closed
     * @throws SessionFactoryException      if a new session had to be created and creation failed
     * @throws AcquireInterruptedException  if the calling thread was interrupted while waiting
     */
    public PooledSession acquire(String affinityKey, Duration maxWait) {
        PoolConfig cfg = config;
        if (!cfg.isPooling()) {
            return acquireOneShot();
        }
        Duration timeout = maxWait != null && maxWait.compareTo(cfg.getAcquireTimeout()) < 0
                ? maxWait : cfg.getAcquireTimeout();
        long startNanos = System.nanoTime();
        long timeoutNanos = saturatedNanos(timeout);
        PooledSession acquired = null;
        PooledSession abandoned = null;
        InterruptedException interrupted = null;
        boolean create = false;
        boolean timedOut = false;

        try (LogContext ignored = LogContext.forAcquire(target, affinityKey)) {
            lock.lock();
            try {
                ensureAcceptingLocked();
                trackAffinityLocked(affinityKey);
                if (waiters.isEmpty()) {
                    acquired = selectAvailableLocked(affinityKey);
                    if (acquired == null && hasCapacityLocked()) {
                        pendingCreations++;
                        create = true;
                    }
                }
                if (acquired == null && !create) {
                    Waiter waiter = new Waiter(affinityKey, lock.newCondition());
                    waiters.addLast(waiter);
                    log.debug("No session available for target {}, waiting (queue={})", target, waiters.size());
                    long remaining = timeoutNanos;
                    try {
                        while (!waiter.isResolved() && remaining > 0) {
                            remaining = waiter.condition.awaitNanos(remaining);
                        }
                    } catch (InterruptedException e) {
                        interrupted = e;
                        abandoned = abandonLocked(waiter);
                    }
                    if (interrupted == null) {
                        if (!waiter.isResolved()) {
                            waiters.remove(waiter);
                            totalTimeouts++;
                            timedOut = true;
                        } else if (waiter.failure != null) {
                            throw waiter.failure;
                        } else if (waiter.session != null) {
                            acquired = waiter.session;
                        } else {
                            create = true;
                        }
                    }
                }
                if (acquired != null) {
                    totalAcquisitions++;
                }
            } finally {
                lock.unlock();
            }

            if (interrupted != null) {
                if (abandoned != null) {
                    destroyQuietly(abandoned);
                }
                Thread.currentThread().interrupt();
                throw new AcquireInterruptedException(target, interrupted);
            }
            if (timedOut) {
                safeMetrics(m -> m.recordAcquireTimeout(target));
                log.warn("Timeout acquiring session for target {} after {}ms", target, timeout.toMillis());
                throw new AcquireTimeoutException(target, timeout);
            }
            if (create) {
                acquired = createForCaller();
            }
            Duration waited = Duration.ofNanos(System.nanoTime() - startNanos);
            boolean created = create;
            safeMetrics(m -> m.recordAcquisition(target, waited, created));
            log.debug("Acquired session {} for target {} (created={}, wait={}ms)",
                    acquired.id(), target, created, waited.toMillis());
            return acquired;
        }
    }

    /**
     * Returns a session to the pool and records the outcome of the work done with it.
     *
     * <p>A draining session, a session reported {@link ReleaseOutcome#broken broken} and a
     * one-shot session are destroyed; any other session becomes available again. Releasing
     * a session the pool no longer tracks (already released, or torn down by a reset) is a no-op.</p>
     */
    public void release(PooledSession session, ReleaseOutcome outcome) {
        if (session == null) {
            return;
        }
        ReleaseOutcome result = outcome != null ? outcome : ReleaseOutcome.success();
        if (!session.isPooled()) {
            releaseOneShot(session, result);
            return;
        }
        Instant now = clock.instant();
        Duration held;
        boolean destroy = false;
        lock.lock();
        try {
            String id = session.id();
            boolean wasDraining = draining.get(id) == session;
            if (!wasDraining && active.get(id) != session) {
                log.debug("Ignoring release of session {} no longer checked out from pool {}", id, target);
                return;
            }
            held = session.recordOutcome(result, now);
            recordOutcomeLocked(result, held);
            totalReleases++;
            if (wasDraining) {
                draining.remove(id);
                killLocked(session);
                destroy = true;
            } else if (result.broken()) {
                active.remove(id);
                killLocked(session);
                destroy = true;
                log.warn("Session {} of target {} reported broken: {}", id, target, result.error());
            } else {
                active.remove(id);
                session.markAvailable();
                available.put(id, session);
            }
            dispatchWaitersLocked();
        } finally {
            lock.unlock();
        }
        if (destroy) {
            destroyQuietly(session);
        }
        safeMetrics(m -> m.recordRelease(target, held, result.successful()));
    }

    /**
     * Runs work on an acquired session and releases it with the matching outcome.
     * A runtime exception from the work is reported as a failed outcome and rethrown.
     */
    public <T> T execute(String affinityKey, Function<SessionHandle, T> work) {
        PooledSession session = acquire(affinityKey);
        try {
            T result = work.apply(session.handle());
            release(session, ReleaseOutcome.success());
            return result;
        } catch (RuntimeException e) {
            release(session, ReleaseOutcome.failure(e.getMessage()));
            throw e;
        }
    }

    // ========== Control operations ==========

    /**
     * Stops the pool from accepting work. Available sessions are destroyed immediately,
     * checked-out sessions are destroyed when released, and waiting callers fail with
     * {@link PoolDrainingException}. Draining lasts until {@link #reset} or {@link #reconfigure}.
     * Calling it again has no further effect.
     */
    public ControlResult drain() {
        try (LogContext ignored = LogContext.forControl(target, "drain")) {
            List<PooledSession> doomed;
            List<String> retiring = new ArrayList<>();
            boolean alreadyDraining;
            lock.lock();
            try {
                if (status == PoolStatus.CLOSED) {
                    throw new PoolDrainingException(target, "Pool for '" + target + "' is closed");
                }
                alreadyDraining = status == PoolStatus.DRAINING;
                status = PoolStatus.DRAINING;
                doomed = new ArrayList<>(available.values());
                available.clear();
                doomed.forEach(this::killLocked);
                for (PooledSession session : active.values()) {
                    session.markDraining();
                    draining.put(session.id(), session);
                    retiring.add(session.id());
                }
                active.clear();
                failWaitersLocked(() -> new PoolDrainingException(target));
            } finally {
                lock.unlock();
            }

            List<String> failures = new ArrayList<>();
            List<String> affected = destroyAll(doomed, failures);
            affected.addAll(retiring);
            String message = alreadyDraining && affected.isEmpty()
                    ? "Pool for '" + target + "' is already draining"
                    : "Pool for '" + target + "' draining: " + doomed.size() + " idle sessions destroyed, "
                    + retiring.size() + " in-use sessions retire on release";
            log.info("Drained pool for target {}: destroyed={} retiring={} failures={}",
                    target, doomed.size(), retiring.size(), failures.size());
            return new ControlResult(target, "drain", message, affected, failures, getStats());
        }
    }

    /**
     * Grows or shrinks the pool toward {@code newSize} and makes it the new target size.
     * Shrinking destroys idle sessions first and retires in-use sessions on release; sessions
     * mid-use are never killed.
     *
     * @throws ConfigValidationException if {@code newSize} is outside {@code [min_size, max_size]}
     *                                   or the pool is unpooled
     * @throws PoolDrainingException     if the pool is draining or closed
     */
    public ControlResult resize(int newSize) {
        try (LogContext ignored = LogContext.forControl(target, "resize")) {
            List<PooledSession> doomed = new ArrayList<>();
            List<String> retiring = new ArrayList<>();
            int toCreate = 0;
            lock.lock();
            try {
                PoolConfig cfg = config;
                if (!cfg.isPooling()) {
                    throw new ConfigValidationException("cannot resize an unpooled pool (strategy none)");
                }
                if (newSize < cfg.getMinSize() || newSize > cfg.getMaxSize()) {
                    throw new ConfigValidationException("size " + newSize + " is outside [min_size, max_size] = ["
                            + cfg.getMinSize() + ", " + cfg.getMaxSize() + "]");
                }
                ensureAcceptingLocked();
                config = cfg.withTargetSize(newSize);
                int live = liveCountLocked() + pendingCreations;
                if (newSize > live) {
                    toCreate = reserveCreationsLocked(newSize - live);
                } else if (newSize < live) {
                    shrinkLocked(live - newSize, doomed, retiring);
                }
            } finally {
                lock.unlock();
            }

            List<String> failures = new ArrayList<>();
            List<String> affected = destroyAll(doomed, failures);
            affected.addAll(retiring);
            createIntoPool(toCreate, affected, failures);
            String message = "Pool for '" + target + "' resized to " + newSize + ": " + toCreate
                    + " requested, " + doomed.size() + " destroyed, " + retiring.size() + " retiring";
            log.info("Resized pool for target {} to {} (create={}, destroyed={}, retiring={}, failures={})",
                    target, newSize, toCreate, doomed.size(), retiring.size(), failures.size());
            return new ControlResult(target, "resize", message, affected, failures, getStats());
        }
    }

    /**
     * Forcibly destroys every session, including checked-out ones, clears all counters and
     * repopulates to {@code target_size}. Also ends a drain.
     */
    public ControlResult reset() {
        try (LogContext ignored = LogContext.forControl(target, "reset")) {
            List<PooledSession> doomed;
            int toCreate;
            lock.lock();
            try {
                if (status == PoolStatus.CLOSED) {
                    throw new PoolDrainingException(target, "Pool for '" + target + "' is closed");
                }
                doomed = removeAllLocked();
                clearCountersLocked();
                strategy.reset();
                status = PoolStatus.ACTIVE;
                toCreate = reserveCreationsLocked(
                        config.isPooling() ? config.getTargetSize() - liveCountLocked() - pendingCreations : 0);
            } finally {
                lock.unlock();
            }

            List<String> failures = new ArrayList<>();
            List<String> affected = destroyAll(doomed, failures);
            List<String> created = new ArrayList<>();
            createIntoPool(toCreate, created, failures);
            affected.addAll(created);
            String message = "Pool for '" + target + "' reset: " + doomed.size() + " sessions destroyed, "
                    + created.size() + " created";
            log.info("Reset pool for target {}: destroyed={} created={} failures={}",
                    target, doomed.size(), created.size(), failures.size());
            return new ControlResult(target, "reset", message, affected, failures, getStats());
        }
    }

    /**
     * Asks the advisor for a strategy matching recent usage and switches to it if it differs.
     * In-flight sessions are unaffected; the new strategy applies to subsequent acquisitions.
     */
    public OptimizationResult optimize(StrategyAdvisor advisor) {
        try (LogContext ignored = LogContext.forControl(target, "optimize")) {
            PoolStrategy current;
            UsageProfile profile;
            lock.lock();
            try {
                current = strategy.type();
                profile = usageProfileLocked();
            } finally {
                lock.unlock();
            }
            StrategyAdvisor.Recommendation recommendation = advisor.recommend(current, profile);
            boolean applied = recommendation.strategy() != current && switchStrategy(current, recommendation.strategy());
            if (applied) {
                log.info("Optimized pool for target {}: {} -> {} ({})",
                        target, current, recommendation.strategy(), recommendation.reason());
            }
            return new OptimizationResult(current, applied ? recommendation.strategy() : current,
                    applied, recommendation.reason());
        }
    }

    /**
     * Applies a new configuration to the running pool. Ends a drain; switches strategy;
     * retires sessions above a lowered {@code max_size}; grows toward {@code target_size};
     * reschedules maintenance if intervals changed.
     */
    public ControlResult reconfigure(PoolConfig newConfig) {
        Objects.requireNonNull(newConfig, "config is required");
        try (LogContext ignored = LogContext.forControl(target, "reconfigure")) {
            PoolConfig old;
            List<PooledSession> doomed = new ArrayList<>();
            List<String> retiring = new ArrayList<>();
            int toCreate = 0;
            PoolStrategy previousStrategy;
            lock.lock();
            try {
                if (status == PoolStatus.CLOSED) {
                    throw new PoolDrainingException(target, "Pool for '" + target + "' is closed");
                }
                old = config;
                config = newConfig;
                previousStrategy = strategy.type();
                if (previousStrategy != newConfig.getStrategy()
                        || !old.getMaxIdleTime().equals(newConfig.getMaxIdleTime())) {
                    strategy = SelectionStrategies.create(newConfig.getStrategy(), newConfig.getMaxIdleTime(), ticker);
                }
                if (!old.getMaxIdleTime().equals(newConfig.getMaxIdleTime())) {
                    Cache<String, Boolean> resized = affinityKeyCache(newConfig.getMaxIdleTime());
                    resized.putAll(seenAffinityKeys.asMap());
                    seenAffinityKeys = resized;
                }
                if (status == PoolStatus.DRAINING) {
                    status = PoolStatus.ACTIVE;
                }
                if (!newConfig.isPooling()) {
                    shrinkLocked(liveCountLocked(), doomed, retiring);
                } else {
                    int live = liveCountLocked() + pendingCreations;
                    if (live > newConfig.getMaxSize()) {
                        shrinkLocked(live - newConfig.getMaxSize(), doomed, retiring);
                    } else if (started.get() && live < newConfig.getTargetSize()) {
                        toCreate = reserveCreationsLocked(newConfig.getTargetSize() - live);
                    }
                }
                dispatchWaitersLocked();
            } finally {
                lock.unlock();
            }

            if (previousStrategy != newConfig.getStrategy()) {
                safeMetrics(m -> m.recordStrategyChange(target, previousStrategy, newConfig.getStrategy()));
            }
            List<String> failures = new ArrayList<>();
            List<String> affected = destroyAll(doomed, failures);
            affected.addAll(retiring);
            createIntoPool(toCreate, affected, failures);
            if (!old.getHealthCheckInterval().equals(newConfig.getHealthCheckInterval())
                    || !old.getRebalanceInterval().equals(newConfig.getRebalanceInterval())) {
                scheduleMaintenance();
            }
            log.info("Reconfigured pool for target {}: {}", target, newConfig);
            return new ControlResult(target, "reconfigure", "Pool for '" + target + "' reconfigured",
                    affected, failures, getStats());
        }
    }

    /**
     * Sets the selection weight of a session, used by the weighted strategy.
     *
     * @return whether the session is tracked by this pool
     */
    public boolean setSessionWeight(String sessionId, double weight) {
        lock.lock();
        try {
            PooledSession session = findLocked(sessionId);
            if (session == null) {
                return false;
            }
            session.setWeight(weight);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ========== Maintenance primitives (health monitor, auto-scaler) ==========

    /**
     * Creates up to {@code count} idle sessions without exceeding {@code max_size}.
     * Creation failures are logged and absorbed.
     *
     * @return the number of sessions created
     */
    public int grow(int count) {
        if (count <= 0) {
            return 0;
        }
        int toCreate;
        lock.lock();
        try {
            if (!acceptingLocked() || !config.isPooling()) {
                return 0;
            }
            toCreate = reserveCreationsLocked(count);
        } finally {
            lock.unlock();
        }
        List<String> created = new ArrayList<>();
        createIntoPool(toCreate, created, new ArrayList<>());
        return created.size();
    }

    /**
     * Destroys up to {@code count} idle sessions, longest idle first.
     *
     * @return the number of sessions destroyed
     */
    public int shrink(int count, String reason) {
        if (count <= 0) {
            return 0;
        }
        List<PooledSession> doomed;
        lock.lock();
        try {
            doomed = available.values().stream()
                    .sorted(Comparator.comparing(PooledSession::lastUsedAt))
                    .limit(count)
                    .toList();
            for (PooledSession session : doomed) {
                available.remove(session.id());
                killLocked(session);
            }
        } finally {
            lock.unlock();
        }
        destroyAll(doomed, new ArrayList<>());
        if (!doomed.isEmpty()) {
            safeMetrics(m -> m.recordEviction(target, reason, doomed.size()));
        }
        return doomed.size();
    }

    /**
     * Destroys the given sessions if they are still idle in this pool and still match
     * {@code stillEligible}, which is re-checked under the pool lock so that a session
     * used since the candidates were chosen survives.
     *
     * @param stillEligible cheap in-memory check; it must not do I/O
     * @return the number of sessions destroyed
     */
    public int retire(Collection<PooledSession> candidates, Predicate<PooledSession> stillEligible, String reason) {
        List<PooledSession> doomed = new ArrayList<>();
        lock.lock();
        try {
            for (PooledSession candidate : candidates) {
                if (available.get(candidate.id()) == candidate && stillEligible.test(candidate)) {
                    available.remove(candidate.id());
                    killLocked(candidate);
                    doomed.add(candidate);
                }
            }
        } finally {
            lock.unlock();
        }
        destroyAll(doomed, new ArrayList<>());
        if (!doomed.isEmpty()) {
            safeMetrics(m -> m.recordEviction(target, reason, doomed.size()));
        }
        return doomed.size();
    }

    /**
     * Snapshot of the idle sessions, in creation order.
     */
    public List<PooledSession> availableSessions() {
        lock.lock();
        try {
            return List.copyOf(available.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Classifies recent outcomes and records the check time.
     *
     * @return the new health, paired with the previous one
     */
    public HealthTransition evaluateHealth() {
        lock.lock();
        try {
            PoolHealth previous = lastHealth;
            lastHealth = healthLocked();
            lastHealthCheck = clock.instant();
            return new HealthTransition(previous, lastHealth);
        } finally {
            lock.unlock();
        }
    }

    public void markRebalanced() {
        lock.lock();
        try {
            lastRebalance = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastHealthCheck() {
        lock.lock();
        try {
            return lastHealthCheck;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastRebalance() {
        lock.lock();
        try {
            return lastRebalance;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Publishes the current stats to the metrics sink.
     */
    public void emitStats() {
        PoolStats stats = getStats();
        safeMetrics(m -> m.emit(target, stats));
    }

    public MetricsSink getMetrics() {
        return metrics;
    }

    // ========== Views ==========

    public PoolStats getStats() {
        lock.lock();
        try {
            double successRate = totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
            double avgResponseMs = totalRequests == 0 ? 0.0 : totalResponseNanos / 1_000_000.0 / totalRequests;
            int total = available.size() + active.size() + draining.size();
            return new PoolStats(
                    total,
                    active.size(),
                    available.size(),
                    draining.size(),
                    totalRequests,
                    successfulRequests,
                    failedRequests,
                    successRate,
                    avgResponseMs,
                    healthLocked(),
                    strategy.type(),
                    status,
                    waiters.size(),
                    totalAcquisitions,
                    totalReleases,
                    totalTimeouts,
                    totalCreated,
                    totalDestroyed
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Summaries of every tracked session in creation order.
     */
    public List<SessionSummary> listSessions() {
        lock.lock();
        try {
            List<PooledSession> all = new ArrayList<>(available.size() + active.size() + draining.size());
            all.addAll(available.values());
            all.addAll(active.values());
            all.addAll(draining.values());
            return all.stream()
                    .sorted(Comparator.comparingLong(PooledSession::sequence))
                    .map(PooledSession::summary)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public UsageProfile usageProfile() {
        lock.lock();
        try {
            return usageProfileLocked();
        } finally {
            lock.unlock();
        }
    }

    // ========== Internals ==========

    private PooledSession acquireOneShot() {
        lock.lock();
        try {
            ensureAcceptingLocked();
        } finally {
            lock.unlock();
        }
        SessionHandle handle = createHandle();
        PooledSession session = new PooledSession(sequence.incrementAndGet(), target, handle, clock.instant(), false);
        session.checkOut(clock.instant());
        lock.lock();
        try {
            totalCreated++;
            totalAcquisitions++;
        } finally {
            lock.unlock();
        }
        safeMetrics(m -> m.recordAcquisition(target, Duration.ZERO, true));
        log.debug("Created one-shot session {} for target {}", session.id(), target);
        return session;
    }

    private void releaseOneShot(PooledSession session, ReleaseOutcome outcome) {
        if (session.state().isTerminal()) {
            return;
        }
        Duration held;
        lock.lock();
        try {
            held = session.recordOutcome(outcome, clock.instant());
            recordOutcomeLocked(outcome, held);
            totalReleases++;
            killLocked(session);
        } finally {
            lock.unlock();
        }
        destroyQuietly(session);
        safeMetrics(m -> m.recordRelease(target, held, outcome.successful()));
    }

    private PooledSession createForCaller() {
        SessionHandle handle;
        try {
            handle = createHandle();
        } catch (SessionFactoryException e) {
            lock.lock();
            try {
                pendingCreations--;
                dispatchWaitersLocked();
            } finally {
                lock.unlock();
            }
            throw e;
        }
        PooledSession session = null;
        boolean discard;
        lock.lock();
        try {
            pendingCreations--;
            discard = !acceptingLocked();
            if (!discard && !config.isPooling()) {
                // pooling was switched off while this caller waited
                session = new PooledSession(sequence.incrementAndGet(), target, handle, clock.instant(), false);
                session.checkOut(clock.instant());
                totalCreated++;
                totalAcquisitions++;
            } else if (!discard) {
                session = newSessionLocked(handle);
                session.checkOut(clock.instant());
                active.put(session.id(), session);
                totalAcquisitions++;
            }
        } finally {
            lock.unlock();
        }
        if (discard) {
            destroyHandleQuietly(handle, "discarded");
            throw new PoolDrainingException(target);
        }
        return session;
    }

    private void createIntoPool(int count, List<String> created, List<String> failures) {
        for (int i = 0; i < count; i++) {
            SessionHandle handle;
            try {
                handle = createHandle();
            } catch (SessionFactoryException e) {
                lock.lock();
                try {
                    pendingCreations--;
                    dispatchWaitersLocked();
                } finally {
                    lock.unlock();
                }
                failures.add("create: " + e.getMessage());
                continue;
            }
            PooledSession session = null;
            lock.lock();
            try {
                pendingCreations--;
                if (acceptingLocked() && config.isPooling()) {
                    session = newSessionLocked(handle);
                    available.put(session.id(), session);
                    dispatchWaitersLocked();
                }
            } finally {
                lock.unlock();
            }
            if (session == null) {
                destroyHandleQuietly(handle, "discarded");
            } else {
                created.add(session.id());
            }
        }
    }

    private SessionHandle createHandle() {
        try {
            SessionHandle handle = factory.create(target);
            if (handle == null) {
                throw new SessionFactoryException("Factory returned no session for '" + target + "'");
            }
            return handle;
        } catch (RuntimeException e) {
            safeMetrics(m -> m.recordFactoryFailure(target, "create"));
            log.warn("Failed to create session for target {}: {}", target, e.getMessage());
            if (e instanceof SessionFactoryException sfe) {
                throw sfe;
            }
            throw new SessionFactoryException("Failed to create session for '" + target + "'", e);
        }
    }

    private PooledSession newSessionLocked(SessionHandle handle) {
        PooledSession session = new PooledSession(sequence.incrementAndGet(), target, handle, clock.instant(), true);
        totalCreated++;
        return session;
    }

    private List<String> destroyAll(List<PooledSession> sessions, List<String> failures) {
        List<String> destroyed = new ArrayList<>();
        for (PooledSession session : sessions) {
            try {
                factory.destroy(session.handle());
                destroyed.add(session.id());
            } catch (RuntimeException e) {
                safeMetrics(m -> m.recordFactoryFailure(target, "destroy"));
                log.warn("Failed to destroy session {} of target {}: {}", session.id(), target, e.getMessage());
                failures.add("destroy " + session.id() + ": " + e.getMessage());
            }
        }
        return destroyed;
    }

    private void destroyQuietly(PooledSession session) {
        destroyHandleQuietly(session.handle(), session.id());
    }

    private void destroyHandleQuietly(SessionHandle handle, String label) {
        try {
            factory.destroy(handle);
        } catch (RuntimeException e) {
            safeMetrics(m -> m.recordFactoryFailure(target, "destroy"));
            log.warn("Failed to destroy session {} of target {}: {}", label, target, e.getMessage());
        }
    }

    private boolean switchStrategy(PoolStrategy expected, PoolStrategy next) {
        lock.lock();
        try {
            if (strategy.type() != expected || !config.isPooling()) {
                return false;
            }
            strategy = SelectionStrategies.create(next, config.getMaxIdleTime(), ticker);
            config = config.withStrategy(next);
        } finally {
            lock.unlock();
        }
        safeMetrics(m -> m.recordStrategyChange(target, expected, next));
        return true;
    }

    private void scheduleMaintenance() {
        lock.lock();
        try {
            cancelMaintenanceLocked();
            if (scheduler == null || status == PoolStatus.CLOSED) {
                return;
            }
            long healthMs = config.getHealthCheckInterval().toMillis();
            long rebalanceMs = config.getRebalanceInterval().toMillis();
            if (healthCycle != null) {
                healthTask = scheduler.scheduleWithFixedDelay(
                        () -> runCycle(healthCycle, "health-check"), healthMs, healthMs, TimeUnit.MILLISECONDS);
            }
            if (rebalanceCycle != null) {
                rebalanceTask = scheduler.scheduleWithFixedDelay(
                        () -> runCycle(rebalanceCycle, "rebalance"), rebalanceMs, rebalanceMs, TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    private void runCycle(Consumer<SessionPool> cycle, String name) {
        try (LogContext ignored = LogContext.forMaintenance(target, name)) {
            cycle.accept(this);
        } catch (RuntimeException e) {
            log.error("Error in {} cycle of pool {}: {}", name, target, e.getMessage(), e);
        }
    }

    private void cancelMaintenance() {
        lock.lock();
        try {
            cancelMaintenanceLocked();
        } finally {
            lock.unlock();
        }
    }

    private void cancelMaintenanceLocked() {
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
        if (rebalanceTask != null) {
            rebalanceTask.cancel(false);
            rebalanceTask = null;
        }
    }

    private void safeMetrics(Consumer<MetricsSink> call) {
        try {
            call.accept(metrics);
        } catch (RuntimeException e) {
            log.debug("Metrics sink failed for target {}: {}", target, e.getMessage());
        }
    }

    private static long saturatedNanos(Duration duration) {
        return duration.compareTo(MAX_WAIT) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    // ---- lock held ----

    private void ensureAcceptingLocked() {
        if (status == PoolStatus.DRAINING) {
            throw new PoolDrainingException(target);
        }
        if (status == PoolStatus.CLOSED) {
            throw new PoolDrainingException(target, "Pool for '" + target + "' is closed");
        }
    }

    private boolean acceptingLocked() {
        return status != PoolStatus.DRAINING && status != PoolStatus.CLOSED;
    }

    private int liveCountLocked() {
        return available.size() + active.size();
    }

    private boolean hasCapacityLocked() {
        return available.size() + active.size() + draining.size() + pendingCreations < config.getMaxSize();
    }

    /**
     * Reserves creation slots without exceeding {@code max_size}.
     */
    private int reserveCreationsLocked(int wanted) {
        int room = config.getMaxSize() - (available.size() + active.size() + draining.size() + pendingCreations);
        int granted = Math.max(0, Math.min(wanted, room));
        pendingCreations += granted;
        return granted;
    }

    private PooledSession selectAvailableLocked(String affinityKey) {
        if (available.isEmpty()) {
            return null;
        }
        PooledSession chosen = strategy.select(new ArrayList<>(available.values()), affinityKey);
        if (chosen == null || available.remove(chosen.id()) == null) {
            return null;
        }
        chosen.checkOut(clock.instant());
        active.put(chosen.id(), chosen);
        return chosen;
    }

    /**
     * Hands idle sessions and free capacity to waiting callers in arrival order.
     */
    private void dispatchWaitersLocked() {
        while (!waiters.isEmpty()) {
            Waiter head = waiters.peekFirst();
            if (!config.isPooling()) {
                head.mayCreate = true;
                pendingCreations++;
            } else {
                PooledSession session = selectAvailableLocked(head.affinityKey);
                if (session != null) {
                    head.session = session;
                } else if (hasCapacityLocked()) {
                    head.mayCreate = true;
                    pendingCreations++;
                } else {
                    return;
                }
            }
            waiters.pollFirst();
            head.condition.signal();
        }
    }

    /**
     * Withdraws an interrupted waiter and gives back whatever it had been granted. A granted
     * session is re-pooled only while it is still checked out; one that a drain or shrink
     * marked draining meanwhile is returned for teardown, and a dead one is left alone.
     *
     * @return a session the caller must destroy outside the lock, or {@code null}
     */
    private PooledSession abandonLocked(Waiter waiter) {
        waiters.remove(waiter);
        PooledSession doomed = null;
        if (waiter.session != null) {
            PooledSession session = waiter.session;
            String id = session.id();
            if (active.get(id) == session) {
                active.remove(id);
                session.markAvailable();
                available.put(id, session);
            } else if (draining.get(id) == session) {
                draining.remove(id);
                killLocked(session);
                doomed = session;
            }
            dispatchWaitersLocked();
        } else if (waiter.mayCreate) {
            pendingCreations--;
            dispatchWaitersLocked();
        }
        return doomed;
    }

    private void failWaitersLocked(Supplier<PoolDrainingException> failure) {
        Waiter waiter;
        while ((waiter = waiters.pollFirst()) != null) {
            waiter.failure = failure.get();
            waiter.condition.signal();
        }
    }

    /**
     * Removes up to {@code count} sessions: idle ones are killed and collected for teardown,
     * then in-use ones are marked draining.
     */
    private void shrinkLocked(int count, List<PooledSession> doomed, List<String> retiring) {
        int remaining = count;
        List<PooledSession> idle = available.values().stream()
                .sorted(Comparator.comparing(PooledSession::lastUsedAt))
                .toList();
        for (PooledSession session : idle) {
            if (remaining == 0) {
                return;
            }
            available.remove(session.id());
            killLocked(session);
            doomed.add(session);
            remaining--;
        }
        List<PooledSession> busy = new ArrayList<>(active.values());
        busy.sort(Comparator.comparingLong(PooledSession::sequence).reversed());
        for (PooledSession session : busy) {
            if (remaining == 0) {
                return;
            }
            active.remove(session.id());
            session.markDraining();
            draining.put(session.id(), session);
            retiring.add(session.id());
            remaining--;
        }
    }

    private List<PooledSession> removeAllLocked() {
        List<PooledSession> all = new ArrayList<>(available.size() + active.size() + draining.size());
        all.addAll(available.values());
        all.addAll(active.values());
        all.addAll(draining.values());
        available.clear();
        active.clear();
        draining.clear();
        all.forEach(this::killLocked);
        return all;
    }

    private void killLocked(PooledSession session) {
        session.markDead();
        totalDestroyed++;
        strategy.onRemoved(session);
    }

    private PooledSession findLocked(String sessionId) {
        PooledSession session = available.get(sessionId);
        if (session == null) {
            session = active.get(sessionId);
        }
        if (session == null) {
            session = draining.get(sessionId);
        }
        return session;
    }

    private void recordOutcomeLocked(ReleaseOutcome outcome, Duration held) {
        totalRequests++;
        if (outcome.successful()) {
            successfulRequests++;
        } else {
            failedRequests++;
        }
        totalResponseNanos += held.toNanos();
        window.record(outcome.successful(), held.toNanos() / 1_000_000.0);
    }

    private void trackAffinityLocked(String affinityKey) {
        if (affinityKey == null) {
            return;
        }
        affinityRequests++;
        if (seenAffinityKeys.getIfPresent(affinityKey) != null) {
            affinityRepeats++;
        } else {
            seenAffinityKeys.put(affinityKey, Boolean.TRUE);
        }
    }

    private PoolHealth healthLocked() {
        if (window.size() == 0) {
            return PoolHealth.HEALTHY;
        }
        return PoolHealth.classify(window.successRate(), config.getHealthCheckThreshold());
    }

    private UsageProfile usageProfileLocked() {
        int live = liveCountLocked();
        double utilization = live == 0 ? 0.0 : (double) active.size() / live;
        double repeatRatio = affinityRequests == 0 ? 0.0 : (double) affinityRepeats / affinityRequests;
        return new UsageProfile(window.size(), window.successRate(), window.meanResponseMs(),
                window.responseVariation(), utilization, repeatRatio);
    }

    private void clearCountersLocked() {
        totalRequests = 0;
        successfulRequests = 0;
        failedRequests = 0;
        totalResponseNanos = 0;
        totalAcquisitions = 0;
        totalReleases = 0;
        totalTimeouts = 0;
        totalCreated = 0;
        totalDestroyed = 0;
        affinityRequests = 0;
        affinityRepeats = 0;
        window.clear();
        seenAffinityKeys.invalidateAll();
        lastHealth = PoolHealth.HEALTHY;
    }

    /**
     * Pool health before and after an evaluation.
     */
    public record HealthTransition(PoolHealth previous, PoolHealth current) {
        public boolean changed() {
            return previous != current;
        }
    }

    private static final class Waiter {
        private final String affinityKey;
        private final Condition condition;
        private PooledSession session;
        private boolean mayCreate;
        private PoolDrainingException failure;

        private Waiter(String affinityKey, Condition condition) {
            this.affinityKey = affinityKey;
            this.condition = condition;
        }

        private boolean isResolved() {
            return session != null || mayCreate || failure != null;
        }
    }
}
