package com.session.pooling.session;

/**
 * Backend-specific session handle created by a {@link SessionFactory}.
 * The pool treats handles opaquely; it only asks whether a handle is still open
 * when probing idle sessions.
 */
public interface SessionHandle {

    /**
     * Returns whether the underlying backend session is still usable.
     * Must be cheap and must not block on network I/O; the health monitor calls it
     * for every idle session on each cycle.
     */
    default boolean isOpen() {
        return true;
    }
}
