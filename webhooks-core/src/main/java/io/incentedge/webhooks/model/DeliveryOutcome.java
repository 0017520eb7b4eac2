package io.incentedge.webhooks.model;

import java.time.Instant;

/**
 * Result of one delivery attempt after it has been persisted.
 */
public sealed interface DeliveryOutcome {

  String deliveryId();

  /** Status the record was moved to. */
  DeliveryStatus status();

  /** Attempts made so far, including this one. */
  int attemptCount();

  default boolean isSuccess() {
    return this instanceof Delivered;
  }

  record Delivered(String deliveryId, int statusCode, long responseTimeMs, int attemptCount)
      implements DeliveryOutcome {
    @Override
    public DeliveryStatus status() {
      return DeliveryStatus.DELIVERED;
    }
  }

  /**
   * @param status      {@link DeliveryStatus#RETRYING} or {@link DeliveryStatus#EXHAUSTED}
   * @param nextRetryAt when the record becomes due again, {@code null} once exhausted
   */
  record Failed(String deliveryId, DeliveryFailure failure, DeliveryStatus status,
                int attemptCount, Instant nextRetryAt) implements DeliveryOutcome {
    public Failed {
      if (status != DeliveryStatus.RETRYING && status != DeliveryStatus.EXHAUSTED) {
        throw new IllegalArgumentException("Failed outcome cannot carry status " + status);
      }
    }
  }
}
