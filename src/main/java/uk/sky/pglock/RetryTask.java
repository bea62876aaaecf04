package uk.sky.pglock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkState;

class RetryTask<T> {
    private final Callable<Optional<T>> action;
    private Duration timeout;
    private Duration pollingInterval;

    private RetryTask(Callable<Optional<T>> action) {
        this.action = action;
    }

    public static <T> RetryTask<T> attempt(Callable<Optional<T>> action) {
        return new RetryTask<>(action);
    }

    /**
     * Calls the action until it produces a value, sleeping the polling interval between calls.
     *
     * @return the first value produced
     * @throws TimeoutException     if no value was produced within the timeout
     * @throws InterruptedException if interrupted while waiting between calls
     */
    public T untilPresent() throws TimeoutException, InterruptedException {
        checkState(timeout != null, "timeout has not been configured");
        checkState(pollingInterval != null, "polling interval has not been configured");

        long startTime = System.currentTimeMillis();
        try {
            Optional<T> result = action.call();
            while (!result.isPresent()) {
                if (timedOut(timeout, startTime)) {
                    throw new TimeoutException(String.format("Timed out after waiting %s ms, with timeout %s ms", System.currentTimeMillis() - startTime, timeout.toMillis()));
                }
                Thread.sleep(pollingInterval.toMillis());
                result = action.call();
            }
            return result.get();
        } catch (RuntimeException | TimeoutException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    private static boolean timedOut(Duration timeout, long startTime) {
        long currentDuration = System.currentTimeMillis() - startTime;
        return currentDuration >= timeout.toMillis();
    }

    public RetryTask<T> withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public RetryTask<T> withPollingInterval(Duration pollingInterval) {
        this.pollingInterval = pollingInterval;
        return this;
    }
}
