package com.session.pooling.pool;

import com.session.pooling.SessionPoolException;

/**
 * Thrown when a caller's wait in acquire is interrupted. The caller has been removed
 * from the wait set and holds no session.
 */
public class AcquireInterruptedException extends SessionPoolException {

    public AcquireInterruptedException(String target, InterruptedException cause) {
        super("Interrupted while waiting for a session of '" + target + "'", cause);
    }
}
