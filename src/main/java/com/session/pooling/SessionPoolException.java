package com.session.pooling;

/**
 * Base class of every runtime exception raised by the session pool manager.
 */
public class SessionPoolException extends RuntimeException {

    public SessionPoolException(String message) {
        super(message);
    }

    public SessionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
