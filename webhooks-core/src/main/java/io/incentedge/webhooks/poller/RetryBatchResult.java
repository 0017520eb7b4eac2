package io.incentedge.webhooks.poller;

/**
 * Counts from one {@link RetryScheduler#processRetries()} run.
 *
 * @param processed records claimed in this run
 * @param succeeded records delivered
 * @param failed    records that failed again, were exhausted, or hit an unexpected error
 */
public record RetryBatchResult(int processed, int succeeded, int failed) {
    public static final RetryBatchResult EMPTY = new RetryBatchResult(0, 0, 0);
}
