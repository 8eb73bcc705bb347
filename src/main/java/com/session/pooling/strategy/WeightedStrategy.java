package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;

import java.util.List;
import java.util.Random;

/**
 * Weighted-random selection. A session's effective weight is its configured weight
 * scaled by its observed success ratio, so sessions that keep failing are picked less often.
 */
public class WeightedStrategy implements SelectionStrategy {

    private final Random random;

    public WeightedStrategy() {
        this(new Random());
    }

    public WeightedStrategy(Random random) {
        this.random = random;
    }

    @Override
    public PoolStrategy type() {
        return PoolStrategy.WEIGHTED;
    }

    @Override
    public PooledSession select(List<PooledSession> available, String affinityKey) {
        if (available.isEmpty()) {
            return null;
        }
        double total = 0;
        for (PooledSession session : available) {
            total += effectiveWeight(session);
        }
        double point = random.nextDouble() * total;
        for (PooledSession session : available) {
            point -= effectiveWeight(session);
            if (point < 0) {
                return session;
            }
        }
        return available.get(available.size() - 1);
    }

    static double effectiveWeight(PooledSession session) {
        return session.weight() * session.successRatio();
    }
}
