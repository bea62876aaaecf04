package uk.sky.pglock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.sky.pglock.exception.CannotAcquireLockException;
import uk.sky.pglock.exception.CannotReleaseLockException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static java.lang.String.format;

/**
 * Session level advisory locks. The server drops them when the session ends, so a process dying
 * while holding the lock never leaves it behind.
 */
class PostgresAdvisoryLockingMechanism extends LockingMechanism {

    private static final Logger log = LoggerFactory.getLogger(PostgresAdvisoryLockingMechanism.class);

    // pg_try_advisory_lock returns at once, pg_advisory_lock would wait for the holder
    static final String TRY_LOCK_QUERY = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_QUERY = "SELECT pg_advisory_unlock(?)";

    /**
     * {@inheritDoc}
     *
     * @throws CannotAcquireLockException if any SQLException is thrown while executing the query.
     */
    @Override
    boolean tryAcquire(Connection connection, LockName lockName) throws CannotAcquireLockException {
        try {
            boolean granted = execute(connection, TRY_LOCK_QUERY, lockName);
            if (!granted) {
                log.info("Lock '{}' currently held by another session", lockName);
            }
            return granted;
        } catch (SQLException e) {
            throw new CannotAcquireLockException(format("Query to acquire lock %s failed to execute", lockName), e);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * The server answers false, with a warning, if this session does not hold the lock.
     *
     * @throws CannotReleaseLockException if any SQLException is thrown while executing the query.
     */
    @Override
    boolean release(Connection connection, LockName lockName) throws CannotReleaseLockException {
        try {
            return execute(connection, UNLOCK_QUERY, lockName);
        } catch (SQLException e) {
            log.error("Query to release lock failed to execute for {}", lockName, e);
            throw new CannotReleaseLockException(format("Query to release lock %s failed to execute", lockName), e);
        }
    }

    private static boolean execute(Connection connection, String query, LockName lockName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(query)) {
            statement.setLong(1, lockName.getKey());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && resultSet.getBoolean(1);
            }
        }
    }
}
