package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;

import java.util.List;

/**
 * Policy choosing which available session to hand out on acquisition.
 *
 * <p>Strategies are invoked by the owning pool while it holds its structural lock,
 * and only ever see the sessions currently in the available state, ordered by
 * creation. They must not block.</p>
 */
public interface SelectionStrategy {

    PoolStrategy type();

    /**
     * Picks one of the available sessions.
     *
     * @param available   available sessions in creation order, never {@code null}
     * @param affinityKey optional client correlation key, may be {@code null}
     * @return the chosen session, or {@code null} if none should be handed out
     */
    PooledSession select(List<PooledSession> available, String affinityKey);

    /**
     * Notifies the strategy that a session left the pool for good.
     */
    default void onRemoved(PooledSession session) {
    }

    /**
     * Drops any per-session state, e.g. after a pool reset.
     */
    default void reset() {
    }
}
