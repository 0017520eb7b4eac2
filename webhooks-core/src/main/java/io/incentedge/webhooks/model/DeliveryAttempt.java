package io.incentedge.webhooks.model;

import java.time.Instant;
import java.util.Map;

/**
 * Everything persisted about one attempt, applied to a record in {@code sending} by
 * {@link io.incentedge.webhooks.spi.DeliveryStore#recordAttempt}.
 *
 * @param newStatus          status after the attempt
 * @param attemptedAt        when the request was sent
 * @param responseStatusCode HTTP status, {@code null} on timeout or transport error
 * @param responseHeaders    response headers, possibly empty
 * @param responseBody       body prefix, {@code null} if none was read
 * @param responseTimeMs     elapsed time of the exchange
 * @param errorMessage       failure text, {@code null} on success
 * @param nextRetryAt        due time when {@code newStatus} is retrying
 */
public record DeliveryAttempt(
    DeliveryStatus newStatus,
    Instant attemptedAt,
    Integer responseStatusCode,
    Map<String, String> responseHeaders,
    String responseBody,
    long responseTimeMs,
    String errorMessage,
    Instant nextRetryAt
) {
  public DeliveryAttempt {
    responseHeaders = responseHeaders == null ? Map.of() : Map.copyOf(responseHeaders);
  }

  /** When the exchange ended; stored as {@code delivered_at} or {@code failed_at}. */
  public Instant completedAt() {
    return attemptedAt.plusMillis(responseTimeMs);
  }
}
