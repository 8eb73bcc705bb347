package com.session.pooling.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    @Nested
    @DisplayName("PoolStrategy")
    class PoolStrategyTests {

        @Test
        @DisplayName("Should parse wire names and constant names")
        void parses() {
            assertEquals(PoolStrategy.LEAST_CONNECTIONS, PoolStrategy.fromString("least_connections"));
            assertEquals(PoolStrategy.ROUND_ROBIN, PoolStrategy.fromString("ROUND_ROBIN"));
            assertEquals(PoolStrategy.STICKY, PoolStrategy.fromString(" sticky "));
            assertEquals(PoolStrategy.ROUND_ROBIN, PoolStrategy.fromString("round-robin"));
        }

        @Test
        @DisplayName("Should reject unknown names")
        void rejectsUnknown() {
            assertThrows(IllegalArgumentException.class, () -> PoolStrategy.fromString("random"));
            assertThrows(IllegalArgumentException.class, () -> PoolStrategy.fromString(""));
        }

        @Test
        @DisplayName("Every strategy should describe itself")
        void descriptions() {
            for (PoolStrategy strategy : PoolStrategy.values()) {
                assertFalse(strategy.description().isBlank());
            }
            assertEquals("weighted", PoolStrategy.WEIGHTED.wireName());
        }
    }

    @Nested
    @DisplayName("PoolHealth")
    class PoolHealthTests {

        @Test
        @DisplayName("Should classify against the threshold and half of it")
        void classify() {
            assertEquals(PoolHealth.HEALTHY, PoolHealth.classify(0.9, 0.8));
            assertEquals(PoolHealth.HEALTHY, PoolHealth.classify(0.8, 0.8));
            assertEquals(PoolHealth.DEGRADED, PoolHealth.classify(0.5, 0.8));
            assertEquals(PoolHealth.UNHEALTHY, PoolHealth.classify(0.39, 0.8));
        }

        @Test
        @DisplayName("worst() should return the worse classification")
        void worst() {
            assertEquals(PoolHealth.DEGRADED, PoolHealth.HEALTHY.worst(PoolHealth.DEGRADED));
            assertEquals(PoolHealth.UNHEALTHY, PoolHealth.UNHEALTHY.worst(PoolHealth.HEALTHY));
        }
    }

    @Test
    @DisplayName("ReleaseOutcome factories should set flags")
    void releaseOutcomes() {
        assertTrue(ReleaseOutcome.success().successful());
        assertFalse(ReleaseOutcome.failure("x").successful());
        assertFalse(ReleaseOutcome.failure("x").broken());
        assertTrue(ReleaseOutcome.broken("reset").broken());
        assertEquals("reset", ReleaseOutcome.broken("reset").error());
    }

    @Test
    @DisplayName("Only dead is a terminal session state")
    void terminalStates() {
        assertTrue(SessionState.DEAD.isTerminal());
        assertFalse(SessionState.DRAINING.isTerminal());
        assertFalse(SessionState.AVAILABLE.isTerminal());
    }
}
