package capi.retry;

import java.time.Duration;

/**
 * Strategy for computing the delay before retrying a failed delivery.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return non-negative delay; zero for {@code attempts <= 0}
     */
    Duration computeDelay(int attempts);
}
