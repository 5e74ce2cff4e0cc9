package com.tracker.infrastructure.persistence;

import com.tracker.infrastructure.exception.ConnectionException;
import com.tracker.infrastructure.exception.PersistenceException;
import com.tracker.infrastructure.exception.TransactionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single lazily opened database connection and the transaction boundaries over it.
 *
 * <p>Connection establishment is coalesced: every caller arriving while a connection is being
 * opened receives the same future. A failed attempt clears the state so the next call starts
 * over; the manager never retries on its own.
 *
 * <p>All work on the connection is serialized by one fair, reentrant lock. A transaction holds
 * the lock from {@link #beginTransaction()} until {@link #commit()} or {@link #rollback()}, so
 * begin and commit/rollback must run on the same thread.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final String CONNECTION_FAILURE_SQLSTATE_CLASS = "08";

    private final DataSource dataSource;
    private final Executor executor;

    private final Object stateLock = new Object();
    private final ReentrantLock usage = new ReentrantLock(true);

    // guarded by stateLock
    private CompletableFuture<Connection> current;

    // guarded by usage
    private Connection transactionConnection;

    public ConnectionManager(DataSource dataSource) {
        this(dataSource, ForkJoinPool.commonPool());
    }

    public ConnectionManager(DataSource dataSource, Executor executor) {
        this.dataSource = dataSource;
        this.executor = executor;
    }

    /**
     * Returns the shared connection, opening it if needed. Completes exceptionally with
     * {@link ConnectionException} when the connection cannot be established.
     */
    public CompletableFuture<Connection> getConnection() {
        synchronized (stateLock) {
            if (current != null) {
                if (!current.isDone() || isUsable(completedConnection(current))) {
                    return current;
                }
                log.warn("Discarding closed database connection");
                current = null;
            }
            CompletableFuture<Connection> attempt = new CompletableFuture<>();
            current = attempt;
            try {
                executor.execute(() -> establish(attempt));
            } catch (RejectedExecutionException e) {
                fail(attempt, e);
            }
            return attempt;
        }
    }

    /**
     * Whether a connection is currently open. Does not trigger establishment.
     */
    public boolean isConnected() {
        synchronized (stateLock) {
            return isUsable(completedConnection(current));
        }
    }

    /**
     * Closes the connection if one is open. State is cleared before closing, so a close
     * failure never leaves a half-closed connection referenced.
     *
     * @throws IllegalStateException if the calling thread has a transaction open
     */
    @Override
    public void close() {
        usage.lock();
        try {
            if (transactionConnection != null) {
                throw new IllegalStateException("Cannot close with a transaction in progress, commit or roll back first");
            }
            CompletableFuture<Connection> toClose;
            synchronized (stateLock) {
                toClose = current;
                current = null;
            }
            if (toClose == null) {
                log.debug("No database connection to close");
                return;
            }
            Connection connection;
            try {
                connection = toClose.join();
            } catch (CompletionException | CancellationException e) {
                // establishment failed and was already reported to its callers
                log.debug("Pending connection attempt had failed, nothing to close");
                return;
            }
            try {
                connection.close();
                log.info("Database connection closed");
            } catch (SQLException e) {
                throw new ConnectionException("Failed to close database connection", e);
            }
        } finally {
            usage.unlock();
        }
    }

    /**
     * Starts a transaction and takes exclusive ownership of the connection for this thread.
     */
    public void beginTransaction() {
        usage.lock();
        try {
            if (transactionConnection != null) {
                throw new IllegalStateException("Nested transactions are not supported");
            }
            Connection connection = awaitConnection();
            connection.setAutoCommit(false);
            transactionConnection = connection;
            log.debug("Transaction started");
        } catch (SQLException e) {
            usage.unlock();
            invalidateIfBroken(e);
            throw new TransactionException("Failed to begin transaction", e);
        } catch (RuntimeException e) {
            usage.unlock();
            throw e;
        }
    }

    /**
     * Commits the current transaction. On failure the transaction stays open and the caller
     * is expected to roll back.
     */
    public void commit() {
        Connection connection = requireTransaction();
        try {
            connection.commit();
        } catch (SQLException e) {
            invalidateIfBroken(e);
            throw new TransactionException("Failed to commit transaction", e);
        }
        finishTransaction(connection);
        log.debug("Transaction committed");
    }

    public void rollback() {
        Connection connection = requireTransaction();
        try {
            connection.rollback();
            log.debug("Transaction rolled back");
        } catch (SQLException e) {
            invalidateIfBroken(e);
            throw new TransactionException("Failed to roll back transaction", e);
        } finally {
            finishTransaction(connection);
        }
    }

    /**
     * Begins a transaction and returns a guard that rolls back unless committed.
     */
    public TransactionScope begin() {
        beginTransaction();
        return new TransactionScope(this, transactionConnection);
    }

    /**
     * Runs the callback in a transaction: commit on normal return, rollback on any exception.
     */
    public <T> T inTransaction(ConnectionCallback<T> callback) {
        try (TransactionScope tx = begin()) {
            T result = callback.doInConnection(tx.connection());
            tx.commit();
            return result;
        } catch (SQLException e) {
            invalidateIfBroken(e);
            throw new PersistenceException("Transactional statement failed: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            invalidateIfBroken(e);
            throw new PersistenceException("Transactional statement failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Runs the callback with exclusive use of the connection. Inside a transaction on the
     * same thread the callback joins that transaction; otherwise it runs in auto-commit mode.
     */
    public <T> T execute(ConnectionCallback<T> callback) {
        usage.lock();
        try {
            Connection connection = transactionConnection != null ? transactionConnection : awaitConnection();
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            invalidateIfBroken(e);
            throw new PersistenceException("Statement failed: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            invalidateIfBroken(e);
            throw new PersistenceException("Statement failed: " + e.getMostSpecificCause().getMessage(), e);
        } finally {
            usage.unlock();
        }
    }

    /**
     * A {@link JdbcTemplate} bound to a connection handed out by this manager. The template
     * never closes the connection; statement failures surface as {@link DataAccessException}
     * and are mapped to {@link PersistenceException} by {@link #execute} and {@link #inTransaction}.
     */
    public static JdbcTemplate jdbcTemplate(Connection connection) {
        JdbcTemplate jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        jdbc.setExceptionTranslator(new SQLStateSQLExceptionTranslator());
        return jdbc;
    }

    private void establish(CompletableFuture<Connection> attempt) {
        try {
            Connection connection = dataSource.getConnection();
            log.info("Database connection established");
            attempt.complete(connection);
        } catch (SQLException | RuntimeException e) {
            fail(attempt, e);
        }
    }

    private void fail(CompletableFuture<Connection> attempt, Exception cause) {
        synchronized (stateLock) {
            if (current == attempt) {
                current = null;
            }
        }
        log.error("Failed to connect to the database: {}", cause.getMessage());
        attempt.completeExceptionally(new ConnectionException("Failed to connect to the database", cause));
    }

    private Connection awaitConnection() {
        try {
            return getConnection().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ConnectionException connectionException) {
                throw connectionException;
            }
            throw new ConnectionException("Failed to obtain database connection", e.getCause());
        }
    }

    private Connection requireTransaction() {
        if (!usage.isHeldByCurrentThread() || transactionConnection == null) {
            throw new IllegalStateException("No transaction in progress on this thread");
        }
        return transactionConnection;
    }

    private void finishTransaction(Connection connection) {
        transactionConnection = null;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit, discarding connection: {}", e.getMessage());
            discard(connection);
        } finally {
            usage.unlock();
        }
    }

    private void invalidateIfBroken(SQLException e) {
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith(CONNECTION_FAILURE_SQLSTATE_CLASS)) {
            log.warn("Connection failure detected (SQLState {}), connection will be re-established", sqlState);
            synchronized (stateLock) {
                Connection connection = completedConnection(current);
                if (connection != null) {
                    discard(connection);
                }
            }
        }
    }

    private void invalidateIfBroken(DataAccessException e) {
        if (e.getCause() instanceof SQLException sqlException) {
            invalidateIfBroken(sqlException);
        }
    }

    private void discard(Connection connection) {
        synchronized (stateLock) {
            if (completedConnection(current) == connection) {
                current = null;
            }
        }
        try {
            connection.close();
        } catch (SQLException closeError) {
            log.debug("Ignoring close failure on discarded connection: {}", closeError.getMessage());
        }
    }

    private static Connection completedConnection(CompletableFuture<Connection> future) {
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return null;
        }
        return future.join();
    }

    private static boolean isUsable(Connection connection) {
        if (connection == null) {
            return false;
        }
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }
}
