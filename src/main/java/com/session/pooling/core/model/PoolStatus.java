package com.session.pooling.core.model;

/**
 * Operational lifecycle of a pool instance.
 */
public enum PoolStatus {
    /** Created, not yet started. */
    IDLE,
    /** Creating its initial sessions. */
    WARMING,
    /** Accepting acquisitions. */
    ACTIVE,
    /** Rejecting acquisitions and retiring sessions; left only by reset or reconfiguration. */
    DRAINING,
    /** Shut down; every session torn down. */
    CLOSED
}
