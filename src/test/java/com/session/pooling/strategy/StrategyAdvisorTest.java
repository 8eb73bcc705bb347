package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StrategyAdvisor Tests")
class StrategyAdvisorTest {

    private final StrategyAdvisor advisor = new StrategyAdvisor();

    private static UsageProfile profile(double successRate, double avgMs, double variation, double repeat) {
        return new UsageProfile(100, successRate, avgMs, variation, 0.5, repeat);
    }

    @Test
    @DisplayName("Balanced workload should recommend round-robin")
    void balanced() {
        StrategyAdvisor.Recommendation r = advisor.recommend(PoolStrategy.WEIGHTED, profile(0.99, 50, 0.1, 0.0));
        assertEquals(PoolStrategy.ROUND_ROBIN, r.strategy());
    }

    @Test
    @DisplayName("Repeat client access should recommend sticky")
    void sticky() {
        assertEquals(PoolStrategy.STICKY,
                advisor.recommend(PoolStrategy.ROUND_ROBIN, profile(0.5, 5000, 2.0, 0.7)).strategy());
    }

    @Test
    @DisplayName("High failure rate should recommend weighted")
    void weighted() {
        assertEquals(PoolStrategy.WEIGHTED,
                advisor.recommend(PoolStrategy.ROUND_ROBIN, profile(0.8, 50, 0.1, 0.0)).strategy());
    }

    @Test
    @DisplayName("Slow responses should recommend least-connections")
    void slow() {
        assertEquals(PoolStrategy.LEAST_CONNECTIONS,
                advisor.recommend(PoolStrategy.ROUND_ROBIN, profile(0.99, 1500, 0.1, 0.0)).strategy());
    }

    @Test
    @DisplayName("Variable response times should recommend least-connections")
    void variable() {
        assertEquals(PoolStrategy.LEAST_CONNECTIONS,
                advisor.recommend(PoolStrategy.ROUND_ROBIN, profile(0.99, 200, 0.9, 0.0)).strategy());
    }

    @Test
    @DisplayName("Too few samples should keep the current strategy")
    void insufficientData() {
        UsageProfile sparse = new UsageProfile(5, 0.1, 5000, 2.0, 1.0, 1.0);
        StrategyAdvisor.Recommendation r = advisor.recommend(PoolStrategy.WEIGHTED, sparse);
        assertEquals(PoolStrategy.WEIGHTED, r.strategy());
        assertTrue(r.reason().startsWith("insufficient data"));
    }

    @Test
    @DisplayName("Unpooled pools should stay unpooled")
    void none() {
        assertEquals(PoolStrategy.NONE,
                advisor.recommend(PoolStrategy.NONE, profile(0.1, 5000, 2.0, 1.0)).strategy());
    }
}
