package com.xendex.backend.scheduler;

import java.time.Duration;

public interface RetryPolicy {

    /**
     * How long a failed task waits before it is claimable again.
     *
     * @param attemptsSoFar attempts already made, including the one that just failed
     */
    Duration delayBeforeRetry(int attemptsSoFar);
}
