package uk.sky.pglock.exception;

/**
 * Thrown if the query to release lock fails or the lock was not held by the session.
 */
public class CannotReleaseLockException extends LockException {

    public CannotReleaseLockException(String message, Throwable cause) {
        super(message, cause);
    }

    public CannotReleaseLockException(String message) {
        super(message);
    }
}
