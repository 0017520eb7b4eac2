package io.incentedge.webhooks.delivery;

import io.incentedge.webhooks.EnvelopeFormatter;
import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.WebhookStorageException;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.testing.Fixtures;
import io.incentedge.webhooks.testing.InMemoryDeliveryStore;
import io.incentedge.webhooks.testing.InMemorySubscriptionStore;
import io.incentedge.webhooks.testing.MutableClock;
import io.incentedge.webhooks.testing.RecordingTransport;
import io.incentedge.webhooks.testing.StubConnections;
import io.incentedge.webhooks.util.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class WebhookTestSenderTest {
  private final MutableClock clock = MutableClock.at("2026-02-01T08:00:00Z");
  private final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();
  private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
  private final RecordingTransport transport = RecordingTransport.respondingWith(204);
  private final EnvelopeFormatter formatter =
      new EnvelopeFormatter(JsonCodec.getDefault(), EventEnvelope.DEFAULT_API_VERSION, clock);

  @BeforeEach
  void setUp() {
    subscriptions.put(Fixtures.subscription("sub_1", "project.created").active(false).build());
  }

  private WebhookTestSender sender(ConnectionProvider provider) {
    DeliveryEngine engine = DeliveryEngine.builder()
        .connectionProvider(provider)
        .deliveryStore(deliveries)
        .subscriptionStore(subscriptions)
        .transport(transport)
        .clock(clock)
        .build();
    return new WebhookTestSender(provider, subscriptions, deliveries, formatter, engine, clock);
  }

  @Test
  void sendsStandardTestEventEvenToInactiveSubscription() {
    DeliveryOutcome outcome = sender(StubConnections.noop()).sendTest(Fixtures.ORG, "sub_1");

    assertTrue(outcome.isSuccess());
    String body = new String(transport.lastRequest().body(), StandardCharsets.UTF_8);
    EventEnvelope envelope = JsonCodec.getDefault().fromJson(body, EventEnvelope.class);
    assertEquals("webhook.test", envelope.event());
    assertEquals(WebhookTestSender.TEST_MESSAGE, envelope.data().get("message"));
    assertEquals("sub_1", envelope.data().get("webhook_id"));
    assertEquals("hook sub_1", envelope.data().get("webhook_name"));
    assertEquals("webhook.test", transport.lastRequest().header("X-IncentEdge-Event"));
  }

  @Test
  void testDeliveryIsRecordedWithSingleAttempt() {
    sender(StubConnections.noop()).sendTest(Fixtures.ORG, "sub_1");

    List<DeliveryRecord> all = deliveries.all();
    assertEquals(1, all.size());
    assertEquals(1, all.get(0).maxAttempts());
    assertEquals(DeliveryStatus.DELIVERED, all.get(0).status());
  }

  @Test
  void failedTestIsNotRetried() {
    transport.setResponder(request -> new WebhookResponse(500, Map.of(), "boom"));

    DeliveryOutcome outcome = sender(StubConnections.noop()).sendTest(Fixtures.ORG, "sub_1");

    assertEquals(DeliveryStatus.EXHAUSTED, outcome.status());
    assertEquals(DeliveryStatus.EXHAUSTED, deliveries.all().get(0).status());
  }

  @Test
  void customDataReplacesTestMessage() {
    sender(StubConnections.noop()).sendTest(Fixtures.ORG, "sub_1", Map.of("project_id", "p9"));

    String body = new String(transport.lastRequest().body(), StandardCharsets.UTF_8);
    EventEnvelope envelope = JsonCodec.getDefault().fromJson(body, EventEnvelope.class);
    assertEquals(Map.of("project_id", "p9"), envelope.data());
  }

  @Test
  void subscriptionOfAnotherOrganizationIsNotFound() {
    Subscription foreign = Fixtures.subscription("sub_2", "project.created").organizationId("org_other").build();
    subscriptions.put(foreign);

    NoSuchElementException e = assertThrows(NoSuchElementException.class,
        () -> sender(StubConnections.noop()).sendTest(Fixtures.ORG, "sub_2"));
    assertEquals("Webhook not found: sub_2", e.getMessage());
    assertThrows(NoSuchElementException.class,
        () -> sender(StubConnections.noop()).sendTest(Fixtures.ORG, "missing"));
    assertTrue(transport.requests().isEmpty());
  }

  @Test
  void storageFailureIsWrapped() {
    assertThrows(WebhookStorageException.class,
        () -> sender(StubConnections.failing()).sendTest(Fixtures.ORG, "sub_1"));
  }
}
