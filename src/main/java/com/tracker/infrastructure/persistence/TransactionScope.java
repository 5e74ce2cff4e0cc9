package com.tracker.infrastructure.persistence;

import java.sql.Connection;

/**
 * Guard for one begin/commit/rollback cycle. Opened by {@link ConnectionManager#begin()}.
 * Closing a scope that was not committed rolls it back; a failing rollback is attached as
 * a suppressed exception to whatever error is already propagating.
 *
 * <pre>{@code
 * try (TransactionScope tx = connectionManager.begin()) {
 *     // statements on tx.connection()
 *     tx.commit();
 * }
 * }</pre>
 */
public final class TransactionScope implements AutoCloseable {

    private final ConnectionManager manager;
    private final Connection connection;
    private boolean completed;

    TransactionScope(ConnectionManager manager, Connection connection) {
        this.manager = manager;
        this.connection = connection;
    }

    public Connection connection() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        return connection;
    }

    public void commit() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        manager.commit();
        completed = true;
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void close() {
        if (!completed) {
            completed = true;
            manager.rollback();
        }
    }
}
