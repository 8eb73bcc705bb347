package com.session.pooling.health;

import com.session.pooling.FakeSessionFactory;
import com.session.pooling.MutableClock;
import com.session.pooling.config.PoolConfig;
import com.session.pooling.core.model.PoolHealth;
import com.session.pooling.core.model.ReleaseOutcome;
import com.session.pooling.metrics.MetricsSink;
import com.session.pooling.metrics.NoOpMetricsSink;
import com.session.pooling.pool.PoolStats;
import com.session.pooling.pool.SessionPool;
import com.session.pooling.session.PooledSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("PoolHealthMonitor Tests")
class PoolHealthMonitorTest {

    private final PoolHealthMonitor monitor = new PoolHealthMonitor();
    private FakeSessionFactory factory;
    private MutableClock clock;
    private SessionPool pool;

    @BeforeEach
    void setUp() {
        factory = new FakeSessionFactory();
        clock = new MutableClock();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private SessionPool startPool(PoolConfig config, MetricsSink metrics) {
        pool = new SessionPool("weather", config, factory, metrics, clock);
        pool.start();
        return pool;
    }

    private SessionPool startPool(PoolConfig config) {
        return startPool(config, new NoOpMetricsSink());
    }

    @Test
    @DisplayName("Should evict idle sessions and replenish to min_size")
    void evictsIdleAndReplenishes() {
        startPool(PoolConfig.builder()
                .minSize(1).maxSize(5).targetSize(2)
                .maxIdleTime(Duration.ofMinutes(1))
                .build());
        clock.advance(Duration.ofMinutes(2));

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(2, report.idleEvicted());
        assertEquals(1, report.replaced());
        assertEquals(1, pool.getStats().totalSessions());
        assertEquals(2, factory.destroyedCount());
        assertEquals(3, factory.createdCount());
    }

    @Test
    @DisplayName("Should leave checked-out sessions alone")
    void skipsActiveSessions() {
        startPool(PoolConfig.builder()
                .minSize(1).maxSize(5).targetSize(2)
                .maxIdleTime(Duration.ofMinutes(1))
                .build());
        PooledSession active = pool.acquire();
        clock.advance(Duration.ofMinutes(2));

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(1, report.idleEvicted());
        assertEquals(0, report.replaced());
        assertEquals(1, pool.getStats().activeSessions());
        pool.release(active, ReleaseOutcome.success());
        assertEquals(1, pool.getStats().availableSessions());
    }

    @Test
    @DisplayName("Should recycle sessions older than max_session_age")
    void recyclesAgedSessions() {
        startPool(PoolConfig.builder()
                .minSize(0).maxSize(5).targetSize(2)
                .maxIdleTime(Duration.ofMinutes(10))
                .maxSessionAge(Duration.ofMinutes(5))
                .build());
        clock.advance(Duration.ofMinutes(6));

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(0, report.idleEvicted());
        assertEquals(2, report.ageEvicted());
        assertEquals(0, pool.getStats().totalSessions());
    }

    @Test
    @DisplayName("Should evict sessions whose handle is no longer open")
    void evictsClosedSessions() {
        startPool(PoolConfig.builder().minSize(1).maxSize(5).targetSize(2).build());
        factory.created().get(0).close();

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(1, report.closedEvicted());
        assertEquals(1, report.totalEvicted());
        assertEquals(1, pool.getStats().totalSessions());
    }

    @Test
    @DisplayName("Should keep an idle candidate that was used while the cycle was probing")
    void keepsSessionUsedDuringCycle() {
        startPool(PoolConfig.builder()
                .minSize(1).maxSize(5).targetSize(2)
                .maxIdleTime(Duration.ofMinutes(1))
                .build());
        clock.advance(Duration.ofMinutes(2));
        pool.release(pool.acquire(), ReleaseOutcome.success());
        factory.onNextProbe(() -> {
            PooledSession first = pool.acquire();
            PooledSession second = pool.acquire();
            pool.release(first, ReleaseOutcome.success());
            pool.release(second, ReleaseOutcome.success());
        });

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(0, report.idleEvicted());
        assertEquals(2, pool.getStats().totalSessions());
        assertEquals(0, factory.destroyedCount());
    }

    @Test
    @DisplayName("Should defer evicting a closed session that was used after its probe")
    void defersClosedSessionUsedAfterProbe() {
        startPool(PoolConfig.builder().minSize(1).maxSize(1).targetSize(1).build());
        factory.created().get(0).close();
        factory.onNextProbe(() -> {
            clock.advance(Duration.ofSeconds(1));
            pool.release(pool.acquire(), ReleaseOutcome.success());
        });

        PoolHealthMonitor.CycleReport first = monitor.runCycle(pool);
        assertEquals(0, first.closedEvicted());
        assertEquals(1, pool.getStats().totalSessions());

        PoolHealthMonitor.CycleReport second = monitor.runCycle(pool);
        assertEquals(1, second.closedEvicted());
        assertEquals(1, second.replaced());
        assertEquals(1, factory.destroyedCount());
    }

    @Test
    @DisplayName("Should not replenish when the auto-scaler owns sizing")
    void noReplenishWithAutoScale() {
        startPool(PoolConfig.builder()
                .minSize(1).maxSize(5).targetSize(1)
                .maxIdleTime(Duration.ofMinutes(1))
                .autoScale(true)
                .build());
        clock.advance(Duration.ofMinutes(2));

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(1, report.idleEvicted());
        assertEquals(0, report.replaced());
        assertEquals(0, pool.getStats().totalSessions());
    }

    @Test
    @DisplayName("Should report health and emit stats")
    void reportsHealth() {
        MetricsSink metrics = mock(MetricsSink.class);
        startPool(PoolConfig.defaults(), metrics);
        for (int i = 0; i < 4; i++) {
            PooledSession session = pool.acquire();
            pool.release(session, ReleaseOutcome.failure("500"));
        }

        PoolHealthMonitor.CycleReport report = monitor.runCycle(pool);

        assertEquals(PoolHealth.UNHEALTHY, report.health());
        verify(metrics).emit(eq("weather"), any(PoolStats.class));
    }

    @Test
    @DisplayName("Failing pool access should not escape the cycle")
    void swallowsCycleErrors() {
        SessionPool broken = mock(SessionPool.class);
        when(broken.getTarget()).thenReturn("broken");
        when(broken.evaluateHealth()).thenThrow(new IllegalStateException("lock poisoned"));

        PoolHealthMonitor.CycleReport report = assertDoesNotThrow(() -> monitor.runCycle(broken));
        assertEquals(0, report.totalEvicted());
    }

    @Test
    @DisplayName("Scheduled cycle should run on health_check_interval")
    void scheduledCycle() throws Exception {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            pool = new SessionPool("weather", PoolConfig.builder()
                    .minSize(0).maxSize(5).targetSize(2)
                    .maxIdleTime(Duration.ofMinutes(1))
                    .healthCheckInterval(Duration.ofMillis(20))
                    .build(), factory, new NoOpMetricsSink(), clock);
            pool.start(scheduler, monitor::runCycle, p -> { });
            clock.advance(Duration.ofMinutes(2));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (pool.getStats().totalSessions() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertEquals(0, pool.getStats().totalSessions());
            assertNotNull(pool.getLastHealthCheck());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
