package uk.sky.pglock;

import uk.sky.pglock.exception.CannotAcquireLockException;
import uk.sky.pglock.exception.CannotReleaseLockException;

import java.sql.Connection;

abstract class LockingMechanism {

    /**
     * Asks the arbiter for the lock without waiting for a current holder to let go.
     *
     * @param connection the session the lock is bound to
     * @param lockName   lock to acquire
     * @return true if the lock was granted, false if another session holds it
     * @throws CannotAcquireLockException if the query to acquire the lock fails
     */
    abstract boolean tryAcquire(Connection connection, LockName lockName) throws CannotAcquireLockException;

    /**
     * @param connection the session holding the lock
     * @param lockName   lock to release
     * @return true if the lock was released. A false value means the session did not hold the lock.
     * @throws CannotReleaseLockException if the query to release the lock fails
     */
    abstract boolean release(Connection connection, LockName lockName) throws CannotReleaseLockException;
}
