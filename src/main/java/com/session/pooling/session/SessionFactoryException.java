package com.session.pooling.session;

import com.session.pooling.SessionPoolException;

/**
 * Thrown when a backend session cannot be created or torn down.
 */
public class SessionFactoryException extends SessionPoolException {

    public SessionFactoryException(String message) {
        super(message);
    }

    public SessionFactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
