package com.session.pooling.config;

import java.util.Map;
import java.util.Optional;

/**
 * Persistence of per-target pool configuration.
 */
public interface ConfigStore {

    /**
     * Loads the configuration saved for a target.
     *
     * @param target the backend target identifier
     * @return the saved configuration, or empty if none was saved
     */
    Optional<PoolConfig> load(String target);

    /**
     * Saves the configuration of a target, replacing any previous one.
     *
     * @param target the backend target identifier
     * @param config an already validated configuration
     */
    void save(String target, PoolConfig config);

    /**
     * Removes the configuration of a target. Unknown targets are ignored.
     */
    void delete(String target);

    /**
     * Returns every saved configuration keyed by target.
     */
    Map<String, PoolConfig> loadAll();
}
