package uk.sky.pglock;

import java.sql.Connection;

/**
 * Work run while the lock is held.
 *
 * @param <T> result of the work
 * @param <X> exception the work may throw
 */
@FunctionalInterface
public interface CriticalSection<T, X extends Exception> {

    /**
     * @param connection the connection holding the lock. It is closed once this returns, do not keep it.
     */
    T execute(Connection connection) throws X;
}
