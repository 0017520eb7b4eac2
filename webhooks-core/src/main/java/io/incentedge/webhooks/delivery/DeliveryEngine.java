package io.incentedge.webhooks.delivery;

import io.incentedge.webhooks.model.DeliveryAttempt;
import io.incentedge.webhooks.model.DeliveryFailure;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.retry.ExponentialBackoffRetryPolicy;
import io.incentedge.webhooks.retry.RetryPolicy;
import io.incentedge.webhooks.signature.WebhookSigner;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.MetricsExporter;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.spi.WebhookRequest;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.spi.WebhookTransport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs one delivery attempt for a record in {@code sending} and persists its outcome.
 *
 * <p>The stored payload is signed and posted as-is, so every attempt sends the bytes that
 * were serialized at dispatch time. After the exchange the engine applies the retry
 * transition (delivered, retrying with backoff, or exhausted), writes it with a conditional
 * update, and updates the subscription's trigger timestamps and counters. Callers never
 * persist anything themselves.
 *
 * <p>This class is thread-safe; a single instance is shared by the dispatcher's worker pool
 * and the retry scheduler.
 */
public final class DeliveryEngine {
  private static final Logger logger = Logger.getLogger(DeliveryEngine.class.getName());

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriptionStore subscriptionStore;
  private final WebhookTransport transport;
  private final WebhookSigner signer;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final DeliveryHeaders headers;
  private final Duration timeout;
  private final Clock clock;

  private DeliveryEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.transport = builder.transport != null ? builder.transport : new HttpClientWebhookTransport();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.signer = builder.signer != null
        ? builder.signer : new WebhookSigner(clock, WebhookSigner.DEFAULT_TOLERANCE);
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.headers = new DeliveryHeaders(builder.productName);
    this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sends a record to its subscription and persists the result.
   *
   * @param subscription the owning subscription (supplies secret and custom headers)
   * @param record       a record currently in {@code sending}; sent to its {@code requestUrl}
   * @return the outcome as persisted
   */
  public DeliveryOutcome attempt(Subscription subscription, DeliveryRecord record) {
    Objects.requireNonNull(subscription, "subscription");
    Objects.requireNonNull(record, "record");

    byte[] body = record.payloadJson().getBytes(StandardCharsets.UTF_8);
    Instant sentAt = clock.instant();
    String signature = signer.sign(body, subscription.secret());
    Map<String, String> requestHeaders = headers.build(
        subscription.customHeaders(), signature, record.eventType(), record.eventId());

    WebhookResponse response = null;
    DeliveryFailure failure;
    long startNanos = System.nanoTime();
    try {
      WebhookRequest request = new WebhookRequest(
          URI.create(record.requestUrl()), requestHeaders, body, timeout);
      response = transport.send(request);
      failure = response.isSuccessful() ? null : new DeliveryFailure.HttpStatus(response.statusCode());
    } catch (HttpTimeoutException e) {
      failure = new DeliveryFailure.Timeout(timeout.toMillis());
    } catch (IOException e) {
      failure = new DeliveryFailure.TransportError(describe(e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failure = new DeliveryFailure.TransportError("Interrupted while sending");
    } catch (RuntimeException e) {
      // invalid URL or a transport bug; still a failed attempt for this record
      failure = new DeliveryFailure.TransportError(describe(e));
    }
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    metrics.recordDeliveryLatencyMs(elapsedMs);

    DeliveryOutcome outcome = transition(record, failure, response, elapsedMs);
    DeliveryAttempt attempt = new DeliveryAttempt(
        outcome.status(),
        sentAt,
        response == null ? null : response.statusCode(),
        response == null ? Map.of() : response.headers(),
        response == null ? null : response.body(),
        elapsedMs,
        failure == null ? null : failure.message(),
        outcome instanceof DeliveryOutcome.Failed failed ? failed.nextRetryAt() : null);
    persist(subscription, record, attempt);
    recordMetrics(outcome);
    return outcome;
  }

  private DeliveryOutcome transition(DeliveryRecord record, DeliveryFailure failure,
      WebhookResponse response, long elapsedMs) {
    int attempts = record.attemptCount() + 1;
    if (failure == null) {
      return new DeliveryOutcome.Delivered(record.id(), response.statusCode(), elapsedMs, attempts);
    }
    if (record.hasAttemptsRemaining()) {
      long delayMs = retryPolicy.computeDelayMs(record.attemptCount());
      Instant nextRetryAt = clock.instant().plusMillis(delayMs);
      logger.log(Level.FINE, "Delivery {0} failed ({1}); retry {2}/{3} at {4}",
          new Object[] {record.id(), failure.message(), attempts, record.maxAttempts() - 1, nextRetryAt});
      return new DeliveryOutcome.Failed(record.id(), failure, DeliveryStatus.RETRYING, attempts, nextRetryAt);
    }
    logger.log(Level.WARNING, "Delivery " + record.id() + " to subscription " + record.subscriptionId()
        + " exhausted after " + attempts + " attempts: " + failure.message());
    return new DeliveryOutcome.Failed(record.id(), failure, DeliveryStatus.EXHAUSTED, attempts, null);
  }

  private void persist(Subscription subscription, DeliveryRecord record, DeliveryAttempt attempt) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = deliveryStore.recordAttempt(conn, record.id(), attempt);
      if (updated == 0) {
        logger.log(Level.SEVERE, "Lost update: delivery " + record.id()
            + " was no longer sending when recording " + attempt.newStatus().code());
        return;
      }
      subscriptionStore.markTriggered(conn, subscription.id(), clock.instant(),
          attempt.newStatus() == DeliveryStatus.DELIVERED);
    } catch (SQLException | RuntimeException e) {
      // record stays sending until the scheduler reclaims it after the lock timeout
      logger.log(Level.SEVERE, "Failed to persist attempt for delivery " + record.id(), e);
    }
  }

  private void recordMetrics(DeliveryOutcome outcome) {
    switch (outcome.status()) {
      case DELIVERED -> metrics.incrementDeliverySuccess();
      case RETRYING -> metrics.incrementDeliveryRetry();
      case EXHAUSTED -> metrics.incrementDeliveryExhausted();
      default -> { }
    }
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  public DeliveryHeaders headers() {
    return headers;
  }

  public Duration timeout() {
    return timeout;
  }

  /** Builder for {@link DeliveryEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private SubscriptionStore subscriptionStore;
    private WebhookTransport transport;
    private WebhookSigner signer;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private String productName = DeliveryHeaders.DEFAULT_PRODUCT_NAME;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> Connections for recording attempts. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /** <b>Required.</b> Receives trigger timestamps and counters. */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** Optional. Defaults to {@link HttpClientWebhookTransport}. */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to a signer on the engine's clock. */
    public Builder signer(WebhookSigner signer) {
      this.signer = signer;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with base 1 s, cap 1 h
     * and multiplier 2.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Product token used in {@code User-Agent} and {@code X-<product>-*} headers. */
    public Builder productName(String productName) {
      this.productName = productName;
      return this;
    }

    /** Optional. Hard deadline per attempt. Defaults to 30 seconds. */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DeliveryEngine build() {
      return new DeliveryEngine(this);
    }
  }
}
