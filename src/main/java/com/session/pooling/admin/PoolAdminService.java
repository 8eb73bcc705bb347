package com.session.pooling.admin;

import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.SessionSummary;
import com.session.pooling.health.HealthStatus;
import com.session.pooling.pool.ControlResult;
import com.session.pooling.pool.OptimizationResult;
import com.session.pooling.pool.PoolStats;
import com.session.pooling.pool.SessionPool;
import com.session.pooling.registry.PoolNotFoundException;
import com.session.pooling.registry.PoolRegistry;
import com.session.pooling.strategy.StrategyAdvisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Administrative operations on session pools, for an API or CLI layer to expose.
 *
 * <p>Every operation addressing an unknown target throws {@link PoolNotFoundException}.
 * Changes made by {@code setConfig}, {@code resize} and {@code optimize} are persisted to the
 * registry's configuration store.</p>
 */
public class PoolAdminService {
    private static final Logger log = LoggerFactory.getLogger(PoolAdminService.class);

    private final PoolRegistry registry;
    private final StrategyAdvisor advisor;

    public PoolAdminService(PoolRegistry registry) {
        this(registry, new StrategyAdvisor());
    }

    public PoolAdminService(PoolRegistry registry, StrategyAdvisor advisor) {
        this.registry = registry;
        this.advisor = advisor;
    }

    /**
     * Returns the configuration of the running pool, or the saved one if the pool was not started yet.
     */
    public PoolConfig getConfig(String target) {
        return registry.find(target)
                .map(SessionPool::getConfig)
                .or(() -> registry.savedConfig(target))
                .orElseThrow(() -> new PoolNotFoundException(target));
    }

    /**
     * Saves and applies a configuration, creating the pool if needed.
     *
     * @return the configuration now in effect
     */
    public PoolConfig setConfig(String target, PoolConfig config) {
        SessionPool pool = registry.applyConfig(target, config);
        log.info("Configuration of target {} updated", target);
        return pool.getConfig();
    }

    public PoolStats getStats(String target) {
        return registry.get(target).getStats();
    }

    public List<SessionSummary> listSessions(String target) {
        return registry.get(target).listSessions();
    }

    public ControlResult drain(String target) {
        return registry.get(target).drain();
    }

    /**
     * Resizes a pool and persists its new target size.
     */
    public ControlResult resize(String target, int newSize) {
        SessionPool pool = registry.get(target);
        ControlResult result = pool.resize(newSize);
        registry.persist(pool);
        return result;
    }

    public ControlResult reset(String target) {
        return registry.get(target).reset();
    }

    /**
     * Switches the pool to the strategy recommended for its recent usage and persists it.
     */
    public OptimizationResult optimize(String target) {
        SessionPool pool = registry.get(target);
        OptimizationResult result = pool.optimize(advisor);
        if (result.applied()) {
            registry.persist(pool);
        }
        return result;
    }

    /**
     * Sets the selection weight of one session.
     *
     * @return whether the session exists
     */
    public boolean setSessionWeight(String target, String sessionId, double weight) {
        return registry.get(target).setSessionWeight(sessionId, weight);
    }

    /**
     * Closes the pool of a target and forgets its configuration.
     */
    public void removeTarget(String target) {
        if (!registry.removePool(target)) {
            throw new PoolNotFoundException(target);
        }
    }

    /**
     * Per-pool health details and the overall (worst) status.
     */
    public HealthStatus globalHealth() {
        return registry.globalHealth();
    }
}
