package com.xendex.backend.scheduler;

import com.xendex.backend.config.TaskSchedulerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Doubles {@code xendex.tasks.backoff-base} for every attempt after the first, stops at
 * {@code xendex.tasks.backoff-max}, then scales the result by a random factor between 0.5 and 1.5
 * so tasks that failed together during one provider outage are not retried together.
 * The jittered delay never exceeds the cap.
 */
@Component
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    // beyond this the cap always wins
    private static final int MAX_DOUBLINGS = 20;

    private final Duration base;
    private final Duration cap;
    private final DoubleSupplier jitter;

    @Autowired
    public ExponentialBackoffRetryPolicy(TaskSchedulerProperties properties) {
        this(properties.backoffBase(), properties.backoffMax(),
                () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    }

    ExponentialBackoffRetryPolicy(Duration base, Duration cap, DoubleSupplier jitter) {
        if (base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("xendex.tasks.backoff-base must be positive, got " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("xendex.tasks.backoff-max " + cap + " is below backoff-base " + base);
        }
        this.base = base;
        this.cap = cap;
        this.jitter = jitter;
    }

    @Override
    public Duration delayBeforeRetry(int attemptsSoFar) {
        if (attemptsSoFar <= 0) {
            return Duration.ZERO;
        }
        int doublings = Math.min(attemptsSoFar - 1, MAX_DOUBLINGS);
        Duration grown = base.multipliedBy(1L << doublings);
        Duration capped = grown.compareTo(cap) > 0 ? cap : grown;

        long jitteredMs = (long) (capped.toMillis() * jitter.getAsDouble());
        return Duration.ofMillis(Math.min(jitteredMs, cap.toMillis()));
    }
}
