package io.incentedge.webhooks.retry;

/**
 * Strategy for computing the delay before the next delivery attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attemptCount the number of attempts already made (0-based: the delay after the
     *                     first failed attempt is {@code computeDelayMs(0)})
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attemptCount);
}
