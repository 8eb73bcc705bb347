package com.session.pooling.registry;

import com.session.pooling.config.ConfigStore;
import com.session.pooling.config.InMemoryConfigStore;
import com.session.pooling.config.PoolConfig;
import com.session.pooling.health.HealthCheckRegistry;
import com.session.pooling.health.HealthStatus;
import com.session.pooling.health.PoolHealthMonitor;
import com.session.pooling.health.SessionPoolHealthCheck;
import com.session.pooling.metrics.MetricsSink;
import com.session.pooling.metrics.NoOpMetricsSink;
import com.session.pooling.pool.SessionPool;
import com.session.pooling.scaling.AutoScaler;
import com.session.pooling.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps backend targets to their session pools.
 *
 * <p>Pools are created lazily on first reference, from the saved configuration of the target
 * (or the registry defaults), or eagerly through {@link #applyConfig} and {@link #loadFromStore}.
 * Lookups are lock-free; only creation and removal take the registry lock. Each pool is started
 * with its health and rebalance cycles on the shared scheduler.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * PoolRegistry registry = PoolRegistry.builder()
 *         .sessionFactory(factory)
 *         .configStore(new JsonFileConfigStore(dir))
 *         .build();
 * SessionPool pool = registry.getOrCreate("tools-server");
 * }</pre>
 */
public class PoolRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);

    private final SessionFactory sessionFactory;
    private final ConfigStore configStore;
    private final MetricsSink metrics;
    private final PoolConfig defaultConfig;
    private final PoolHealthMonitor healthMonitor;
    private final AutoScaler autoScaler;
    private final HealthCheckRegistry healthChecks = new HealthCheckRegistry();
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final ConcurrentMap<String, SessionPool> pools = new ConcurrentHashMap<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile boolean shutdown = false;

    private PoolRegistry(Builder builder) {
        this.sessionFactory = Objects.requireNonNull(builder.sessionFactory, "sessionFactory is required");
        this.configStore = builder.configStore != null ? builder.configStore : new InMemoryConfigStore();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsSink();
        this.defaultConfig = builder.defaultConfig != null ? builder.defaultConfig : PoolConfig.defaults();
        this.healthMonitor = builder.healthMonitor != null ? builder.healthMonitor : new PoolHealthMonitor();
        this.autoScaler = builder.autoScaler != null ? builder.autoScaler : new AutoScaler();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : createScheduler(builder.schedulerThreads);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the pool of a target, creating and starting it if needed.
     */
    public SessionPool getOrCreate(String target) {
        SessionPool existing = pools.get(target);
        if (existing != null) {
            return existing;
        }
        return createPool(target, null);
    }

    public Optional<SessionPool> find(String target) {
        return Optional.ofNullable(pools.get(target));
    }

    /**
     * @throws PoolNotFoundException if the target has no pool
     */
    public SessionPool get(String target) {
        SessionPool pool = pools.get(target);
        if (pool == null) {
            throw new PoolNotFoundException(target);
        }
        return pool;
    }

    public Set<String> targets() {
        return new TreeSet<>(pools.keySet());
    }

    /**
     * Saves a configuration and applies it, creating the pool if it does not exist yet.
     * Nothing is applied if the configuration cannot be saved.
     *
     * @return the pool running with the configuration
     */
    public SessionPool applyConfig(String target, PoolConfig config) {
        requireTarget(target);
        Objects.requireNonNull(config, "config is required");
        configStore.save(target, config);
        SessionPool existing = pools.get(target);
        if (existing != null) {
            existing.reconfigure(config);
            return existing;
        }
        SessionPool created = createPool(target, config);
        if (!created.getConfig().equals(config)) {
            created.reconfigure(config);
        }
        return created;
    }

    /**
     * Saves the configuration a pool is currently running with, e.g. after a resize.
     */
    public void persist(SessionPool pool) {
        configStore.save(pool.getTarget(), pool.getConfig());
    }

    /**
     * Returns the saved configuration of a target that has no running pool.
     */
    public Optional<PoolConfig> savedConfig(String target) {
        return configStore.load(target);
    }

    /**
     * Creates a pool for every saved configuration not already loaded.
     *
     * @return the number of pools created
     */
    public int loadFromStore() {
        Map<String, PoolConfig> saved = configStore.loadAll();
        int created = 0;
        for (Map.Entry<String, PoolConfig> entry : saved.entrySet()) {
            if (!pools.containsKey(entry.getKey())) {
                createPool(entry.getKey(), entry.getValue());
                created++;
            }
        }
        log.info("Loaded {} pools from configuration store ({} saved)", created, saved.size());
        return created;
    }

    /**
     * Closes the pool of a target and deletes its saved configuration.
     *
     * @return whether a pool existed
     */
    public boolean removePool(String target) {
        SessionPool removed;
        lifecycleLock.lock();
        try {
            removed = pools.remove(target);
            healthChecks.unregister(target);
        } finally {
            lifecycleLock.unlock();
        }
        configStore.delete(target);
        if (removed == null) {
            return false;
        }
        removed.close();
        log.info("Removed pool for target {}", target);
        return true;
    }

    /**
     * Aggregate health of every pool, worst status first.
     */
    public HealthStatus globalHealth() {
        return healthChecks.checkAll();
    }

    public HealthCheckRegistry getHealthChecks() {
        return healthChecks;
    }

    /**
     * Closes every pool and stops the scheduler if the registry created it.
     */
    public void shutdown() {
        List<SessionPool> closing;
        lifecycleLock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            closing = new ArrayList<>(pools.values());
            pools.clear();
        } finally {
            lifecycleLock.unlock();
        }
        for (SessionPool pool : closing) {
            try {
                pool.close();
            } catch (RuntimeException e) {
                log.warn("Error closing pool {}: {}", pool.getTarget(), e.getMessage());
            }
            healthChecks.unregister(pool.getTarget());
        }
        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Pool registry shut down: {} pools closed", closing.size());
    }

    @Override
    public void close() {
        shutdown();
    }

    private SessionPool createPool(String target, PoolConfig explicitConfig) {
        requireTarget(target);
        SessionPool pool;
        lifecycleLock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("Pool registry is shut down");
            }
            SessionPool existing = pools.get(target);
            if (existing != null) {
                return existing;
            }
            PoolConfig config = explicitConfig != null
                    ? explicitConfig
                    : configStore.load(target).orElse(defaultConfig);
            pool = new SessionPool(target, config, sessionFactory, metrics, clock);
            pools.put(target, pool);
            healthChecks.register(new SessionPoolHealthCheck(pool));
        } finally {
            lifecycleLock.unlock();
        }
        log.info("Created pool for target {} with {}", target, pool.getConfig());
        pool.start(scheduler, healthMonitor::runCycle, autoScaler::runCycle);
        return pool;
    }

    private static void requireTarget(String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be null or blank");
        }
    }

    private static ScheduledExecutorService createScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, runnable -> {
            Thread thread = new Thread(runnable, "session-pool-maintenance-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public static class Builder {
        private SessionFactory sessionFactory;
        private ConfigStore configStore;
        private MetricsSink metrics;
        private PoolConfig defaultConfig;
        private PoolHealthMonitor healthMonitor;
        private AutoScaler autoScaler;
        private ScheduledExecutorService scheduler;
        private int schedulerThreads = 2;
        private Clock clock;

        public Builder sessionFactory(SessionFactory sessionFactory) {
            this.sessionFactory = sessionFactory;
            return this;
        }

        public Builder configStore(ConfigStore configStore) {
            this.configStore = configStore;
            return this;
        }

        public Builder metrics(MetricsSink metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Configuration of targets with no saved configuration.
         */
        public Builder defaultConfig(PoolConfig defaultConfig) {
            this.defaultConfig = defaultConfig;
            return this;
        }

        public Builder healthMonitor(PoolHealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public Builder autoScaler(AutoScaler autoScaler) {
            this.autoScaler = autoScaler;
            return this;
        }

        /**
         * Scheduler running pool maintenance. The registry does not shut down a scheduler it was given.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            if (schedulerThreads < 1) {
                throw new IllegalArgumentException("schedulerThreads must be at least 1");
            }
            this.schedulerThreads = schedulerThreads;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PoolRegistry build() {
            return new PoolRegistry(this);
        }
    }
}
