package com.session.pooling.config;

import com.session.pooling.SessionPoolException;

/**
 * Thrown when pool configuration cannot be read from or written to its store.
 */
public class ConfigStoreException extends SessionPoolException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
