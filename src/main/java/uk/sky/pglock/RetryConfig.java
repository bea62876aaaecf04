package uk.sky.pglock;

import java.time.Duration;

/**
 * How long {@link AdvisoryLocks#withLockRetrying} keeps asking for a lock held elsewhere.
 */
public class RetryConfig {

    private final Duration pollingInterval, timeout;

    private RetryConfig(Duration pollingInterval, Duration timeout) {
        this.pollingInterval = pollingInterval;
        this.timeout = timeout;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static RetryConfigBuilder builder() {
        return new RetryConfigBuilder();
    }

    public static class RetryConfigBuilder {

        private Duration pollingInterval = Duration.ofMillis(500);
        private Duration timeout = Duration.ofMinutes(1);

        private RetryConfigBuilder() {}

        /**
         * Duration to wait after each attempt to acquire the lock.
         *
         * @param pollingInterval defaults to 500 milliseconds.
         * @return this
         * @throws IllegalArgumentException if value is less than 0
         */
        public RetryConfigBuilder withPollingInterval(Duration pollingInterval) {
            if (pollingInterval.toMillis() < 0)
                throw new IllegalArgumentException("Polling interval must be positive: " + pollingInterval.toMillis());

            this.pollingInterval = pollingInterval;
            return this;
        }

        /**
         * Duration to attempt to acquire lock for.
         *
         * @param timeout defaults to 1 minute
         * @return this
         * @throws IllegalArgumentException if value is less than 0
         */
        public RetryConfigBuilder withTimeout(Duration timeout) {
            if (timeout.toMillis() < 0)
                throw new IllegalArgumentException("Timeout must be positive: " + timeout.toMillis());

            this.timeout = timeout;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(pollingInterval, timeout);
        }
    }
}
