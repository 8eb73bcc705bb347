package com.session.pooling.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ConfigStore}.
 * This is the default store; configuration does not survive a restart.
 */
public class InMemoryConfigStore implements ConfigStore {

    private final ConcurrentMap<String, PoolConfig> configs = new ConcurrentHashMap<>();

    @Override
    public Optional<PoolConfig> load(String target) {
        return Optional.ofNullable(configs.get(target));
    }

    @Override
    public void save(String target, PoolConfig config) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be null or blank");
        }
        configs.put(target, config);
    }

    @Override
    public void delete(String target) {
        configs.remove(target);
    }

    @Override
    public Map<String, PoolConfig> loadAll() {
        return Map.copyOf(configs);
    }
}
