package uk.sky.pglock;

import org.junit.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public class RetryConfigBuilderTest {

    @Test
    public void shouldDefaultToHalfSecondPollingForOneMinute() {
        //when
        RetryConfig retryConfig = RetryConfig.builder().build();

        //then
        assertThat(retryConfig.getPollingInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(retryConfig.getTimeout()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    public void shouldThrowExceptionIfPollingIntervalIsNegative() throws Exception {
        //when
        Throwable throwable = catchThrowable(() -> RetryConfig.builder().withPollingInterval(Duration.ofMillis(-1)));

        //then
        assertThat(throwable)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Polling interval must be positive: -1");
    }

    @Test
    public void shouldThrowExceptionIfTimeoutIsNegative() throws Exception {
        //when
        Throwable throwable = catchThrowable(() -> RetryConfig.builder().withTimeout(Duration.ofMillis(-1)));

        //then
        assertThat(throwable)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Timeout must be positive: -1");
    }
}
