package uk.sky.pglock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.sky.pglock.exception.CannotAcquireLockException;
import uk.sky.pglock.exception.CannotReleaseLockException;
import uk.sky.pglock.exception.ConnectionException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;

/**
 * A single attempt to hold an exclusive advisory lock.
 * <p>
 * Each attempt opens its own connection and asks the server for the lock on it without waiting.
 * If the lock is granted the connection is handed to the caller for the critical section and stays
 * open until {@link #close()}. If it is not, the connection is closed straight away and
 * {@link CannotAcquireLockException} is thrown. Instances are single use and are not thread safe.
 * <pre>{@code
 * try (AdvisoryLock lock = advisoryLocks.acquire("gold_leader")) {
 *     Connection connection = lock.getConnection();
 *     // critical section
 * }
 * }</pre>
 */
public final class AdvisoryLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLock.class);

    /**
     * {@code DENIED}, {@code CONNECT_FAILED} and {@code CLOSED} are terminal, no connection is open in any of them.
     */
    public enum State {
        UNACQUIRED, HELD, DENIED, CONNECT_FAILED, CLOSED
    }

    private final LockName lockName;
    private final ConnectionConfig connectionConfig;
    private final ConnectionFactory connectionFactory;
    private final LockingMechanism lockingMechanism;
    private final String applicationName;

    private State state = State.UNACQUIRED;
    private Connection connection;
    private boolean acquired;

    AdvisoryLock(LockName lockName, ConnectionConfig connectionConfig, ConnectionFactory connectionFactory, LockingMechanism lockingMechanism) {
        this.lockName = lockName;
        this.connectionConfig = connectionConfig;
        this.connectionFactory = connectionFactory;
        this.lockingMechanism = lockingMechanism;
        this.applicationName = connectionConfig.getApplicationName()
                .orElseGet(() -> format("%s-%s-lock", UUID.randomUUID(), lockName));
    }

    /**
     * Opens the dedicated connection and asks for the lock once.
     *
     * @throws ConnectionException        if the connection cannot be opened, no lock was requested
     * @throws CannotAcquireLockException if another session holds the lock or the lock query fails,
     *                                    the connection has been closed
     * @throws IllegalStateException      if this attempt has been made before
     */
    void acquire() throws ConnectionException, CannotAcquireLockException {
        checkState(state == State.UNACQUIRED, "Lock attempt for %s has already been made", lockName);

        log.info("Attempting to acquire lock for '{}', using application name '{}'", lockName, applicationName);
        try {
            connection = connectionFactory.connect(connectionConfig, applicationName);
        } catch (RuntimeException e) {
            state = State.CONNECT_FAILED;
            log.warn("Unable to connect to acquire lock for '{}'", lockName);
            throw e;
        }

        boolean granted;
        try {
            granted = lockingMechanism.tryAcquire(connection, lockName);
        } catch (RuntimeException e) {
            log.warn("Unable to acquire lock for '{}'", lockName, e);
            closeConnection();
            state = State.DENIED;
            throw e instanceof CannotAcquireLockException
                    ? e
                    : new CannotAcquireLockException(format("Query to acquire lock %s failed to execute", lockName), e);
        }

        if (!granted) {
            closeConnection();
            state = State.DENIED;
            throw new CannotAcquireLockException(format("Lock %s currently in use", lockName));
        }

        acquired = true;
        state = State.HELD;
        log.info("Acquired lock for '{}'", lockName);
    }

    /**
     * @return the connection the lock is held on. Use it for all work inside the critical section.
     * @throws IllegalStateException if the lock is not held
     */
    public Connection getConnection() {
        checkState(state == State.HELD, "Lock %s is not held, current state is %s", lockName, state);
        return connection;
    }

    /**
     * Releases the lock and closes the connection. Calling this more than once, or on an attempt that
     * did not get the lock, does nothing.
     * <p>
     * The connection is closed even if releasing fails; the server drops the lock with the session.
     *
     * @throws CannotReleaseLockException if the query to release the lock fails or the session no longer held it
     */
    @Override
    public void close() throws CannotReleaseLockException {
        if (state != State.HELD) {
            if (state == State.UNACQUIRED) {
                state = State.CLOSED;
            }
            return;
        }

        CannotReleaseLockException failure = null;
        try {
            log.info("Attempting to release lock for '{}', using application name '{}'", lockName, applicationName);
            if (!lockingMechanism.release(connection, lockName)) {
                failure = new CannotReleaseLockException(format("Lock %s was not held by session %s", lockName, applicationName));
            }
        } catch (CannotReleaseLockException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new CannotReleaseLockException(format("Failed to release lock %s", lockName), e);
        } finally {
            acquired = false;
            closeConnection();
            state = State.CLOSED;
        }

        if (failure != null) {
            log.warn("Unable to release lock for '{}'", lockName, failure);
            throw failure;
        }
        log.info("Lock released for '{}'", lockName);
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection '{}' for lock '{}'", applicationName, lockName, e);
        } finally {
            connection = null;
        }
    }

    public LockName getLockName() {
        return lockName;
    }

    /**
     * @return name of the lock connection as seen in {@code pg_stat_activity}
     */
    public String getApplicationName() {
        return applicationName;
    }

    public boolean isAcquired() {
        return acquired;
    }

    public State getState() {
        return state;
    }
}
