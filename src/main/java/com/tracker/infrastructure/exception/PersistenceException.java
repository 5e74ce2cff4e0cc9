package com.tracker.infrastructure.exception;

/**
 * Unchecked wrapper for failures talking to the backing database.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
