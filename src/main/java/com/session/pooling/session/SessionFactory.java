package com.session.pooling.session;

/**
 * Creates and destroys backend sessions for a target.
 * Implemented by the transport layer of each protocol binding.
 */
public interface SessionFactory {

    /**
     * Establishes a new backend session.
     *
     * @param target the backend target identifier
     * @return a new, exclusively owned handle
     * @throws SessionFactoryException if the session cannot be established
     */
    SessionHandle create(String target);

    /**
     * Tears a backend session down. Called exactly once per handle.
     *
     * @param handle the handle to destroy
     * @throws SessionFactoryException if teardown fails
     */
    void destroy(SessionHandle handle);
}
