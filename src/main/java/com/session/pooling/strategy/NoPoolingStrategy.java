package com.session.pooling.strategy;

import com.session.pooling.core.model.PoolStrategy;
import com.session.pooling.session.PooledSession;

import java.util.List;

/**
 * Never hands out a pooled session; every acquisition gets a fresh one-shot session.
 */
public class NoPoolingStrategy implements SelectionStrategy {

    @Override
    public PoolStrategy type() {
        return PoolStrategy.NONE;
    }

    @Override
    public PooledSession select(List<PooledSession> available, String affinityKey) {
        return null;
    }
}
