package com.session.pooling.pool;

import com.session.pooling.SessionPoolException;

import java.time.Duration;

/**
 * Thrown when no session became available within the acquire timeout.
 * The caller may retry.
 */
public class AcquireTimeoutException extends SessionPoolException {

    private final String target;
    private final Duration timeout;

    public AcquireTimeoutException(String target, Duration timeout) {
        super("Timeout waiting for a session of '" + target + "' (timeout=" + timeout.toMillis() + "ms)");
        this.target = target;
        this.timeout = timeout;
    }

    public String getTarget() {
        return target;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
