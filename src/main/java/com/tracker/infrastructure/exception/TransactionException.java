package com.tracker.infrastructure.exception;

/**
 * Begin, commit or rollback failed.
 */
public class TransactionException extends PersistenceException {

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
