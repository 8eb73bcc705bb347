package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;

import java.util.List;

/**
 * Rotates over sessions in creation order.
 *
 * <p>The rotation index is the creation sequence of the last session handed out, so the
 * rotation stays stable while sessions move in and out of the available set: the next
 * pick is the first available session created after it, wrapping to the oldest.</p>
 */
public class RoundRobinStrategy implements SelectionStrategy {

    private long lastSequence = -1;

    @Override
    public PoolStrategy type() {
        return PoolStrategy.ROUND_ROBIN;
    }

    @Override
    public PooledSession select(List<PooledSession> available, String affinityKey) {
        if (available.isEmpty()) {
            return null;
        }
        PooledSession next = null;
        PooledSession first = null;
        for (PooledSession session : available) {
            if (first == null || session.sequence() < first.sequence()) {
                first = session;
            }
            if (session.sequence() > lastSequence
                    && (next == null || session.sequence() < next.sequence())) {
                next = session;
            }
        }
        PooledSession chosen = next != null ? next : first;
        lastSequence = chosen.sequence();
        return chosen;
    }

    @Override
    public void reset() {
        lastSequence = -1;
    }
}
