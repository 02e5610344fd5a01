package com.xendex.backend.scheduler;

import com.xendex.backend.config.TaskSchedulerProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffRetryPolicyTest {

    private static final Duration BASE = Duration.ofSeconds(30);
    private static final Duration CAP = Duration.ofHours(1);

    @Test
    void delayBeforeRetry_NoAttemptsYet_ShouldBeZero() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(BASE, CAP, () -> 1.0);

        assertThat(policy.delayBeforeRetry(0)).isZero();
    }

    @Test
    void delayBeforeRetry_WithoutJitter_ShouldDoublePerAttempt() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(BASE, CAP, () -> 1.0);

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.delayBeforeRetry(4)).isEqualTo(Duration.ofMinutes(4));
    }

    @Test
    void delayBeforeRetry_ShouldApplyJitterFactor() {
        RetryPolicy shortened = new ExponentialBackoffRetryPolicy(BASE, CAP, () -> 0.5);
        RetryPolicy stretched = new ExponentialBackoffRetryPolicy(BASE, CAP, () -> 1.25);

        assertThat(shortened.delayBeforeRetry(3)).isEqualTo(Duration.ofMinutes(1));
        assertThat(stretched.delayBeforeRetry(3)).isEqualTo(Duration.ofMinutes(2).plusSeconds(30));
    }

    @Test
    void delayBeforeRetry_ManyAttempts_ShouldNeverExceedCap() {
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(BASE, CAP, () -> 1.49);

        for (int attempts : new int[]{8, 21, 64, Integer.MAX_VALUE}) {
            assertThat(policy.delayBeforeRetry(attempts)).isEqualTo(CAP);
        }
    }

    @Test
    void delayBeforeRetry_ConfiguredFromProperties_ShouldStayWithinJitterBounds() {
        TaskSchedulerProperties properties = new TaskSchedulerProperties(50, Duration.ofMinutes(15), 5,
                Duration.ofSeconds(10), Duration.ofMinutes(10), Duration.ofDays(30),
                new TaskSchedulerProperties.Worker(5, 20, 100));
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(properties);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayBeforeRetry(2)).isBetween(Duration.ofSeconds(10), Duration.ofSeconds(30));
        }
    }

    @Test
    void constructor_InvalidBounds_ShouldThrow() {
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(Duration.ZERO, CAP, () -> 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(CAP, BASE, () -> 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backoff-max");
    }
}
