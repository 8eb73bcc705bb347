package com.session.pooling.registry;

import com.session.pooling.FakeSessionFactory;
import com.session.pooling.config.ConfigStore;
import com.session.pooling.config.InMemoryConfigStore;
import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.PoolStatus;
import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.health.HealthStatus;
import com.session.pooling.pool.SessionPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoolRegistry Tests")
class PoolRegistryTest {

    private FakeSessionFactory factory;
    private ConfigStore store;
    private PoolRegistry registry;

    @BeforeEach
    void setUp() {
        factory = new FakeSessionFactory();
        store = new InMemoryConfigStore();
        registry = PoolRegistry.builder()
                .sessionFactory(factory)
                .configStore(store)
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    @DisplayName("getOrCreate should lazily create and warm up a pool with defaults")
    void lazyCreation() {
        assertTrue(registry.find("weather").isEmpty());

        SessionPool pool = registry.getOrCreate("weather");

        assertSame(pool, registry.getOrCreate("weather"));
        assertEquals(PoolStatus.ACTIVE, pool.getStatus());
        assertEquals(PoolConfig.defaults(), pool.getConfig());
        assertEquals(2, factory.createdCount());
        assertEquals(Set.of("weather"), registry.targets());
    }

    @Test
    @DisplayName("getOrCreate should use the saved configuration of the target")
    void usesSavedConfig() {
        PoolConfig saved = PoolConfig.builder().strategy(PoolStrategy.STICKY).targetSize(3).build();
        store.save("weather", saved);

        SessionPool pool = registry.getOrCreate("weather");

        assertEquals(saved, pool.getConfig());
        assertEquals(3, pool.getStats().totalSessions());
    }

    @Test
    @DisplayName("Concurrent getOrCreate should create exactly one pool")
    void concurrentCreation() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SessionPool>> futures = new ArrayList<>();
            Callable<SessionPool> task = () -> registry.getOrCreate("weather");
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(task));
            }
            SessionPool first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<SessionPool> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("get should throw for unknown targets")
    void getUnknown() {
        PoolNotFoundException e = assertThrows(PoolNotFoundException.class, () -> registry.get("missing"));
        assertEquals("missing", e.getTarget());
    }

    @Test
    @DisplayName("applyConfig should save and reconfigure a running pool")
    void applyConfig() {
        SessionPool pool = registry.getOrCreate("weather");
        PoolConfig updated = PoolConfig.builder().strategy(PoolStrategy.LEAST_CONNECTIONS).targetSize(4).build();

        SessionPool applied = registry.applyConfig("weather", updated);

        assertSame(pool, applied);
        assertEquals(updated, pool.getConfig());
        assertEquals(PoolStrategy.LEAST_CONNECTIONS, pool.getStrategy());
        assertEquals(4, pool.getStats().totalSessions());
        assertEquals(updated, store.load("weather").orElseThrow());
    }

    @Test
    @DisplayName("loadFromStore should create a pool per saved configuration")
    void loadFromStore() {
        store.save("weather", PoolConfig.defaults());
        store.save("search", PoolConfig.builder().targetSize(1).build());

        assertEquals(2, registry.loadFromStore());
        assertEquals(0, registry.loadFromStore());
        assertEquals(Set.of("search", "weather"), registry.targets());
    }

    @Test
    @DisplayName("removePool should close the pool and delete its configuration")
    void removePool() {
        SessionPool pool = registry.applyConfig("weather", PoolConfig.defaults());

        assertTrue(registry.removePool("weather"));

        assertEquals(PoolStatus.CLOSED, pool.getStatus());
        assertEquals(2, factory.destroyedCount());
        assertTrue(store.load("weather").isEmpty());
        assertTrue(registry.find("weather").isEmpty());
        assertFalse(registry.removePool("weather"));
    }

    @Test
    @DisplayName("globalHealth should include every pool")
    void globalHealth() {
        registry.getOrCreate("weather");
        registry.getOrCreate("search");
        registry.get("search").drain();

        HealthStatus health = registry.globalHealth();

        assertTrue(health.isDegraded());
        assertTrue(health.details().containsKey("weather"));
        assertTrue(health.details().containsKey("search"));
    }

    @Test
    @DisplayName("shutdown should close every pool and refuse new ones")
    void shutdown() {
        SessionPool pool = registry.getOrCreate("weather");

        registry.shutdown();

        assertEquals(PoolStatus.CLOSED, pool.getStatus());
        assertTrue(registry.targets().isEmpty());
        assertThrows(IllegalStateException.class, () -> registry.getOrCreate("search"));
    }

    @Test
    @DisplayName("Builder should require a session factory")
    void requiresFactory() {
        assertThrows(NullPointerException.class, () -> PoolRegistry.builder().build());
    }
}
