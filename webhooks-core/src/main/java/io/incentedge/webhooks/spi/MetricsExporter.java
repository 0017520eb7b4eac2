package io.incentedge.webhooks.spi;

/**
 * Observability hook for exporting webhook counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of delivery records created by dispatch.
     */
    void incrementRecordsCreated();

    /**
     * Increments the count of subscriptions skipped because their filters did not match.
     */
    void incrementFiltered();

    /**
     * Increments the count of attempts that ended in {@code delivered}.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed attempts that were scheduled for retry.
     */
    void incrementDeliveryRetry();

    /**
     * Increments the count of records moved to {@code exhausted}.
     */
    void incrementDeliveryExhausted();

    /**
     * Adds the number of records claimed by one scheduler run.
     *
     * @param count records claimed
     */
    default void recordRetryClaimed(int count) {
    }

    /**
     * Records the round-trip time of the latest HTTP attempt.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRecordsCreated() {
        }

        @Override
        public void incrementFiltered() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryRetry() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }
    }
}
