package com.session.pooling.registry;

import com.session.pooling.SessionPoolException;

/**
 * Thrown when an operation references a target with no pool.
 */
public class PoolNotFoundException extends SessionPoolException {

    private final String target;

    public PoolNotFoundException(String target) {
        super("No session pool for target '" + target + "'");
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
