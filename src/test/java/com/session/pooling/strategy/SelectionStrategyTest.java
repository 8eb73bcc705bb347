package com.session.pooling.strategy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.core.model.ReleaseOutcome;
import com.session.pooling.session.PooledSession;
import com.session.pooling.session.SessionHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Selection Strategy Tests")
class SelectionStrategyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static PooledSession session(long sequence) {
        return new PooledSession(sequence, "tools", new SessionHandle() { }, T0, true);
    }

    private static void serve(PooledSession session, int requests, boolean success, Instant at) {
        for (int i = 0; i < requests; i++) {
            session.checkOut(at);
            session.recordOutcome(success ? ReleaseOutcome.success() : ReleaseOutcome.failure("err"), at);
        }
    }

    @Nested
    @DisplayName("RoundRobinStrategy")
    class RoundRobinTests {

        @Test
        @DisplayName("Should rotate in creation order and wrap around")
        void rotates() {
            RoundRobinStrategy strategy = new RoundRobinStrategy();
            List<PooledSession> available = List.of(session(1), session(2), session(3));

            assertEquals(1, strategy.select(available, null).sequence());
            assertEquals(2, strategy.select(available, null).sequence());
            assertEquals(3, strategy.select(available, null).sequence());
            assertEquals(1, strategy.select(available, null).sequence());
        }

        @Test
        @DisplayName("Should skip sessions that are not available")
        void skipsMissing() {
            RoundRobinStrategy strategy = new RoundRobinStrategy();
            PooledSession s1 = session(1);
            PooledSession s3 = session(3);

            assertEquals(1, strategy.select(List.of(s1, s3), null).sequence());
            assertEquals(3, strategy.select(List.of(s1, s3), null).sequence());
        }

        @Test
        @DisplayName("Should return null when nothing is available")
        void empty() {
            assertNull(new RoundRobinStrategy().select(List.of(), null));
        }

        @Test
        @DisplayName("reset() should restart the rotation")
        void reset() {
            RoundRobinStrategy strategy = new RoundRobinStrategy();
            List<PooledSession> available = List.of(session(1), session(2));
            strategy.select(available, null);
            strategy.reset();
            assertEquals(1, strategy.select(available, null).sequence());
        }
    }

    @Nested
    @DisplayName("LeastConnectionsStrategy")
    class LeastConnectionsTests {

        @Test
        @DisplayName("Should pick the session with the fewest requests")
        void fewestRequests() {
            PooledSession busy = session(1);
            PooledSession quiet = session(2);
            serve(busy, 5, true, T0.plusSeconds(1));
            serve(quiet, 2, true, T0.plusSeconds(1));

            assertSame(quiet, new LeastConnectionsStrategy().select(List.of(busy, quiet), null));
        }

        @Test
        @DisplayName("Ties should go to the longest idle session")
        void tieBreaksOnLastUse() {
            PooledSession recent = session(1);
            PooledSession stale = session(2);
            serve(recent, 1, true, T0.plusSeconds(30));
            serve(stale, 1, true, T0.plusSeconds(10));

            assertSame(stale, new LeastConnectionsStrategy().select(List.of(recent, stale), null));
        }
    }

    @Nested
    @DisplayName("StickyStrategy")
    class StickyTests {

        @Test
        @DisplayName("Same affinity key should get the same session")
        void keepsAffinity() {
            StickyStrategy strategy = new StickyStrategy(Duration.ofMinutes(5));
            List<PooledSession> available = List.of(session(1), session(2), session(3));

            PooledSession first = strategy.select(available, "client-a");
            strategy.select(available, "client-b");

            assertSame(first, strategy.select(available, "client-a"));
            assertEquals(first.id(), strategy.mappedSession("client-a").orElseThrow());
        }

        @Test
        @DisplayName("Should fall back and remap when the mapped session is busy")
        void fallsBackWhenBusy() {
            StickyStrategy strategy = new StickyStrategy(Duration.ofMinutes(5));
            PooledSession s1 = session(1);
            PooledSession s2 = session(2);

            PooledSession first = strategy.select(List.of(s1, s2), "client-a");
            List<PooledSession> remaining = new ArrayList<>(List.of(s1, s2));
            remaining.remove(first);

            PooledSession fallback = strategy.select(remaining, "client-a");

            assertNotSame(first, fallback);
            assertEquals(fallback.id(), strategy.mappedSession("client-a").orElseThrow());
        }

        @Test
        @DisplayName("Removing a session should drop its mappings")
        void onRemoved() {
            StickyStrategy strategy = new StickyStrategy(Duration.ofMinutes(5));
            PooledSession s1 = session(1);
            strategy.select(List.of(s1), "client-a");

            strategy.onRemoved(s1);

            assertTrue(strategy.mappedSession("client-a").isEmpty());
        }

        @Test
        @DisplayName("Mappings should expire after the TTL without use")
        void mappingsExpire() {
            AtomicLong nanos = new AtomicLong();
            StickyStrategy strategy = new StickyStrategy(Duration.ofMinutes(5), nanos::get);
            strategy.select(List.of(session(1), session(2)), "client-a");

            nanos.addAndGet(Duration.ofMinutes(4).toNanos());
            assertTrue(strategy.mappedSession("client-a").isPresent());

            nanos.addAndGet(Duration.ofMinutes(6).toNanos());
            assertTrue(strategy.mappedSession("client-a").isEmpty());
        }

        @Test
        @DisplayName("Without a key should behave like round-robin")
        void noKey() {
            StickyStrategy strategy = new StickyStrategy(Duration.ofMinutes(5));
            List<PooledSession> available = List.of(session(1), session(2));
            assertEquals(1, strategy.select(available, null).sequence());
            assertEquals(2, strategy.select(available, null).sequence());
        }
    }

    @Nested
    @DisplayName("WeightedStrategy")
    class WeightedTests {

        @Test
        @DisplayName("Heavier sessions should be picked more often")
        void prefersHeavier() {
            WeightedStrategy strategy = new WeightedStrategy(new Random(42));
            PooledSession light = session(1);
            PooledSession heavy = session(2);
            heavy.setWeight(9.0);

            int heavyPicks = 0;
            for (int i = 0; i < 1000; i++) {
                if (strategy.select(List.of(light, heavy), null) == heavy) {
                    heavyPicks++;
                }
            }

            assertTrue(heavyPicks > 800, "heavy picked " + heavyPicks + " times");
        }

        @Test
        @DisplayName("Failing sessions should have a lower effective weight")
        void penalizesFailures() {
            PooledSession healthy = session(1);
            PooledSession failing = session(2);
            serve(healthy, 9, true, T0);
            serve(failing, 9, false, T0);

            assertEquals(1.0, WeightedStrategy.effectiveWeight(healthy), 1e-9);
            assertEquals(0.1, WeightedStrategy.effectiveWeight(failing), 1e-9);
        }

        @Test
        @DisplayName("Should reject non-positive weights")
        void rejectsBadWeight() {
            assertThrows(IllegalArgumentException.class, () -> session(1).setWeight(0));
        }
    }

    @Test
    @DisplayName("NoPoolingStrategy should never select")
    void noPooling() {
        assertNull(new NoPoolingStrategy().select(List.of(session(1)), null));
    }

    @Test
    @DisplayName("SelectionStrategies should create every variant")
    void factory() {
        for (PoolStrategy type : PoolStrategy.values()) {
            assertEquals(type, SelectionStrategies.create(type, Duration.ofMinutes(1), Ticker.systemTicker()).type());
        }
    }
}
