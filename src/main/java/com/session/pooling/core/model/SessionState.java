package com.session.pooling.core.model;

/**
 * Lifecycle state of a pooled session.
 *
 * <pre>
 * AVAILABLE &lt;-&gt; ACTIVE
 * AVAILABLE | ACTIVE -&gt; DRAINING
 * DRAINING | AVAILABLE | ACTIVE -&gt; DEAD
 * </pre>
 *
 * <p>{@link #DEAD} is terminal for a session instance.</p>
 */
public enum SessionState {
    /** Checked out by exactly one caller. */
    ACTIVE,
    /** Idle in the pool and acquirable. */
    AVAILABLE,
    /** Will not be reused; destroyed when returned. */
    DRAINING,
    /** Removed from the pool and torn down. */
    DEAD;

    public boolean isTerminal() {
        return this == DEAD;
    }
}
