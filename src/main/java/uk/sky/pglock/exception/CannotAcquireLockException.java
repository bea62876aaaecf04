package uk.sky.pglock.exception;

/**
 * Thrown if the lock is currently held by another session or the
 * query to acquire it fails. The dedicated connection has already
 * been closed when this is thrown.
 */
public class CannotAcquireLockException extends LockException {

    public CannotAcquireLockException(String message) {
        super(message);
    }

    public CannotAcquireLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
