package uk.sky.pglock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.sky.pglock.exception.CannotAcquireLockException;
import uk.sky.pglock.exception.CannotReleaseLockException;
import uk.sky.pglock.exception.ConnectionException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs work while holding a named PostgreSQL advisory lock, so that only one process at a time
 * executes it.
 * <p>
 * Each call opens a dedicated connection and asks for the lock once, without waiting. If another
 * session holds the lock the call fails fast with {@link CannotAcquireLockException}; whether to
 * retry, wait or give up is left to the caller ({@link #withLockRetrying} covers the common case).
 * The lock is released and the connection closed whichever way the work finishes.
 * <pre>{@code
 * AdvisoryLocks locks = AdvisoryLocks.create(ConnectionConfig.fromEnvironment());
 * locks.withLock("gold_leader", connection -> {
 *     try (Statement statement = connection.createStatement()) {
 *         return statement.executeUpdate("UPDATE billing SET ...");
 *     }
 * });
 * }</pre>
 */
public class AdvisoryLocks {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLocks.class);

    private final ConnectionConfig connectionConfig;
    private final ConnectionFactory connectionFactory;
    private final LockingMechanism lockingMechanism;

    AdvisoryLocks(ConnectionConfig connectionConfig, ConnectionFactory connectionFactory, LockingMechanism lockingMechanism) {
        this.connectionConfig = requireNonNull(connectionConfig);
        this.connectionFactory = requireNonNull(connectionFactory);
        this.lockingMechanism = requireNonNull(lockingMechanism);
    }

    public static AdvisoryLocks create(ConnectionConfig connectionConfig) {
        return create(connectionConfig, new PostgresConnectionFactory());
    }

    /**
     * @param connectionConfig  settings for the connection opened by each lock attempt
     * @param connectionFactory opens the connections; each call must return a new, unpooled connection
     * @return locks on the database described by {@code connectionConfig}
     */
    public static AdvisoryLocks create(ConnectionConfig connectionConfig, ConnectionFactory connectionFactory) {
        return new AdvisoryLocks(connectionConfig, connectionFactory, new PostgresAdvisoryLockingMechanism());
    }

    /**
     * Acquires the lock once and runs {@code criticalSection} on the connection holding it.
     *
     * @see #withLock(LockName, CriticalSection)
     */
    public static <T, X extends Exception> T withLock(String name, ConnectionConfig connectionConfig, CriticalSection<T, X> criticalSection) throws X {
        return create(connectionConfig).withLock(name, criticalSection);
    }

    public <T, X extends Exception> T withLock(String name, CriticalSection<T, X> criticalSection) throws X {
        return withLock(LockName.of(name), criticalSection);
    }

    /**
     * Acquires the lock once and runs {@code criticalSection} on the connection holding it. The lock
     * is released after {@code criticalSection} has returned or thrown. If both the critical section
     * and the release fail, the release failure is added to the critical section's exception as
     * suppressed.
     *
     * @return whatever {@code criticalSection} returns
     * @throws ConnectionException        if the connection cannot be opened
     * @throws CannotAcquireLockException if the lock is held by another session or the query to acquire it fails
     * @throws CannotReleaseLockException if the query to release the lock fails
     * @throws X                          if {@code criticalSection} throws
     */
    public <T, X extends Exception> T withLock(LockName lockName, CriticalSection<T, X> criticalSection) throws X {
        try (AdvisoryLock lock = acquire(lockName)) {
            return criticalSection.execute(lock.getConnection());
        }
    }

    /**
     * Same as {@link #withLock(LockName, CriticalSection)}, run on {@code executor}. Failures complete
     * the future exceptionally with the exception thrown. Cancelling the future does not stop the
     * critical section, and the lock is still released once it finishes.
     */
    public <T> CompletableFuture<T> withLockAsync(LockName lockName, CriticalSection<T, ?> criticalSection, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return withLock(lockName, criticalSection);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    public <T> CompletableFuture<T> withLockAsync(String name, CriticalSection<T, ?> criticalSection, Executor executor) {
        return withLockAsync(LockName.of(name), criticalSection, executor);
    }

    /**
     * Keeps asking for the lock every {@link RetryConfig#getPollingInterval()} until it is granted or
     * {@link RetryConfig#getTimeout()} passes, then runs {@code criticalSection} as
     * {@link #withLock(LockName, CriticalSection)} does. Only contention is retried, connection
     * failures are thrown straight away.
     *
     * @throws CannotAcquireLockException if the lock could not be acquired before the timeout or polling was interrupted
     */
    public <T, X extends Exception> T withLockRetrying(LockName lockName, RetryConfig retryConfig, CriticalSection<T, X> criticalSection) throws X {
        try (AdvisoryLock lock = acquire(lockName, retryConfig)) {
            return criticalSection.execute(lock.getConnection());
        }
    }

    public <T, X extends Exception> T withLockRetrying(String name, RetryConfig retryConfig, CriticalSection<T, X> criticalSection) throws X {
        return withLockRetrying(LockName.of(name), retryConfig, criticalSection);
    }

    public AdvisoryLock acquire(String name) {
        return acquire(LockName.of(name));
    }

    /**
     * Acquires the lock once. The returned lock must be closed, preferably with try-with-resources.
     *
     * @throws ConnectionException        if the connection cannot be opened
     * @throws CannotAcquireLockException if the lock is held by another session or the query to acquire it fails
     */
    public AdvisoryLock acquire(LockName lockName) {
        AdvisoryLock lock = new AdvisoryLock(lockName, connectionConfig, connectionFactory, lockingMechanism);
        lock.acquire();
        return lock;
    }

    AdvisoryLock acquire(LockName lockName, RetryConfig retryConfig) {
        try {
            return RetryTask.attempt(() -> tryAcquire(lockName))
                    .withTimeout(retryConfig.getTimeout())
                    .withPollingInterval(retryConfig.getPollingInterval())
                    .untilPresent();
        } catch (TimeoutException te) {
            log.warn("Unable to acquire lock for '{}'", lockName, te);
            throw new CannotAcquireLockException("Lock currently in use", te);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException(format("Polling to acquire lock %s was interrupted", lockName), e);
        }
    }

    private Optional<AdvisoryLock> tryAcquire(LockName lockName) {
        try {
            return Optional.of(acquire(lockName));
        } catch (CannotAcquireLockException e) {
            log.debug("Lock '{}' not acquired, will retry: {}", lockName, e.getMessage());
            return Optional.empty();
        }
    }
}
