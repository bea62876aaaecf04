package uk.sky.pglock.exception;

/**
 * Base class for failures to enter or leave a critical section guarded by an advisory lock.
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
