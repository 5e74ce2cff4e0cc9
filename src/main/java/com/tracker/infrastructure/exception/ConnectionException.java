package com.tracker.infrastructure.exception;

/**
 * The database connection could not be established or closed.
 * Callers retry by requesting the connection again.
 */
public class ConnectionException extends PersistenceException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
