package io.incentedge.webhooks.model;

/**
 * Why a delivery attempt did not succeed.
 */
public sealed interface DeliveryFailure {

  /** Text stored in the delivery record's {@code error_message}. */
  String message();

  /** Whether another attempt may succeed. */
  default boolean retryable() {
    return true;
  }

  /** The receiver answered with a non-2xx status. */
  record HttpStatus(int code) implements DeliveryFailure {
    @Override
    public String message() {
      return "HTTP " + code;
    }
  }

  /** The attempt exceeded its deadline. */
  record Timeout(long timeoutMs) implements DeliveryFailure {
    @Override
    public String message() {
      return "Request timed out after " + timeoutMs + "ms";
    }
  }

  /** Connection, TLS or I/O failure before a response was read. */
  record TransportError(String detail) implements DeliveryFailure {
    @Override
    public String message() {
      return detail == null || detail.isBlank() ? "Transport error" : detail;
    }
  }

  /** The owning subscription was deactivated or deleted before a retry. */
  record SubscriptionInactive() implements DeliveryFailure {
    @Override
    public String message() {
      return "Webhook inactive or deleted";
    }

    @Override
    public boolean retryable() {
      return false;
    }
  }
}
