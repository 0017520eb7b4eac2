package io.incentedge.webhooks.model;

/**
 * Lifecycle of a delivery record.
 *
 * <pre>
 * pending -> sending -> delivered
 *                    -> retrying -> sending -> ... -> delivered | exhausted
 * </pre>
 *
 * {@link #FAILED} is accepted when reading rows written by other producers and counted as
 * a failure in statistics; this library moves failed attempts straight to
 * {@link #RETRYING} or {@link #EXHAUSTED}.
 */
public enum DeliveryStatus {
  PENDING("pending"),
  SENDING("sending"),
  DELIVERED("delivered"),
  FAILED("failed"),
  RETRYING("retrying"),
  EXHAUSTED("exhausted");

  private final String code;

  DeliveryStatus(String code) {
    this.code = code;
  }

  /** Value stored in the {@code status} column. */
  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DELIVERED || this == EXHAUSTED;
  }

  public static DeliveryStatus fromCode(String code) {
    for (DeliveryStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + code);
  }
}
