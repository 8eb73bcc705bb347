package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the session that has served the fewest requests; ties go to the one
 * that has been idle the longest.
 */
public class LeastConnectionsStrategy implements SelectionStrategy {

    private static final Comparator<PooledSession> ORDER =
            Comparator.comparingLong(PooledSession::requestCount)
                    .thenComparing(PooledSession::lastUsedAt)
                    .thenComparingLong(PooledSession::sequence);

    @Override
    public PoolStrategy type() {
        return PoolStrategy.LEAST_CONNECTIONS;
    }

    @Override
    public PooledSession select(List<PooledSession> available, String affinityKey) {
        return available.stream().min(ORDER).orElse(null);
    }
}
