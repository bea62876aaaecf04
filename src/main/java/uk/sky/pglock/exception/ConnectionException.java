package uk.sky.pglock.exception;

/**
 * Thrown if the dedicated connection for a lock attempt cannot be opened.
 * No lock request has been issued when this is thrown.
 */
public class ConnectionException extends LockException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
