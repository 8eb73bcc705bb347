package com.session.pooling.pool;

import com.session.pooling.SessionPoolException;

/**
 * Thrown when a pool no longer accepts work because it is draining or closed.
 * Not retryable against the same pool instance.
 */
public class PoolDrainingException extends SessionPoolException {

    private final String target;

    public PoolDrainingException(String target) {
        this(target, "Pool for '" + target + "' is draining");
    }

    public PoolDrainingException(String target, String message) {
        super(message);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
