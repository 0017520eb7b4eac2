package io.incentedge.webhooks.delivery;

import io.incentedge.webhooks.EnvelopeFormatter;
import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.WebhookEventType;
import io.incentedge.webhooks.WebhookStorageException;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Sends a {@code webhook.test} event to a single subscription and waits for the result.
 *
 * <p>The delivery is recorded like any other but with a budget of one attempt, so a failed
 * test goes straight to {@code exhausted} and is never retried. The subscription does not
 * need to subscribe to {@code webhook.test}, and inactive subscriptions can be tested.
 */
public final class WebhookTestSender {
  static final String TEST_MESSAGE = "This is a test webhook delivery from IncentEdge";

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryStore deliveryStore;
  private final EnvelopeFormatter formatter;
  private final DeliveryEngine engine;
  private final Clock clock;

  public WebhookTestSender(ConnectionProvider connectionProvider, SubscriptionStore subscriptionStore,
      DeliveryStore deliveryStore, EnvelopeFormatter formatter, DeliveryEngine engine, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.subscriptionStore = Objects.requireNonNull(subscriptionStore, "subscriptionStore");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Sends the standard test payload.
   *
   * @see #sendTest(String, String, Map)
   */
  public DeliveryOutcome sendTest(String organizationId, String subscriptionId) {
    return sendTest(organizationId, subscriptionId, null);
  }

  /**
   * Sends a test event.
   *
   * @param organizationId organization the subscription must belong to
   * @param subscriptionId subscription to test
   * @param customData     data to send instead of the standard test message, or {@code null}
   * @return the persisted outcome
   * @throws NoSuchElementException   if the subscription does not exist in the organization
   * @throws WebhookStorageException  if the test record cannot be read or created
   */
  public DeliveryOutcome sendTest(String organizationId, String subscriptionId, Map<String, ?> customData) {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(subscriptionId, "subscriptionId");
    DeliveryRecord record;
    Subscription subscription;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      subscription = subscriptionStore.findById(conn, subscriptionId)
          .filter(s -> s.organizationId().equals(organizationId))
          .orElseThrow(() -> new NoSuchElementException("Webhook not found: " + subscriptionId));

      Object data = customData != null ? customData : defaultData(subscription);
      EventEnvelope envelope = formatter.format(
          WebhookEventType.WEBHOOK_TEST.wireName(), data, organizationId, null);
      Instant now = clock.instant();
      record = DeliveryRecord.builder()
          .id(Ids.newId())
          .subscriptionId(subscription.id())
          .organizationId(organizationId)
          .eventId(envelope.id())
          .eventType(envelope.event())
          .payloadJson(formatter.serialize(envelope))
          .status(DeliveryStatus.SENDING)
          .attemptCount(0)
          .maxAttempts(1)
          .scheduledAt(now)
          .lockedAt(now)
          .requestUrl(subscription.url())
          .createdAt(now)
          .build();
      deliveryStore.insertNew(conn, record);
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to create test delivery for " + subscriptionId, e);
    }
    return engine.attempt(subscription, record);
  }

  private static Map<String, Object> defaultData(Subscription subscription) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", TEST_MESSAGE);
    data.put("webhook_id", subscription.id());
    data.put("webhook_name", subscription.name());
    return data;
  }
}
