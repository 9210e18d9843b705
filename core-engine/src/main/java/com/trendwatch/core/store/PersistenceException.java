package com.trendwatch.core.store;

/**
 * Raised when a store cannot commit or load a registry snapshot. After a
 * failed commit the previous committed state is still the durable one.
 *
 * @since 1.0.0
 */
public class PersistenceException extends Exception {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
