package com.hostsentinel.monitor.store;

/**
 * A database operation failed.
 *
 * <p>
 * Unchecked: callers on the polling path log it and carry on, so a broken
 * database never stops monitoring. Only failing to open the initial pool is
 * fatal.
 * </p>
 *
 * @since 1.0.0
 */
public class PersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
