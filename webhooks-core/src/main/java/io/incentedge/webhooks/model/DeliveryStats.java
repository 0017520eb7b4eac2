package io.incentedge.webhooks.model;

/**
 * Delivery counts for one subscription over a time window. {@code failed} counts records in
 * {@code failed} or {@code exhausted}; records still in flight count only toward the total.
 */
public record DeliveryStats(long total, long delivered, long failed) {
  public static final DeliveryStats EMPTY = new DeliveryStats(0, 0, 0);
}
