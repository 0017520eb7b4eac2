package io.incentedge.webhooks.delivery;

import io.incentedge.webhooks.model.DeliveryFailure;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.signature.WebhookSigner;
import io.incentedge.webhooks.spi.WebhookRequest;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.testing.Fixtures;
import io.incentedge.webhooks.testing.InMemoryDeliveryStore;
import io.incentedge.webhooks.testing.InMemorySubscriptionStore;
import io.incentedge.webhooks.testing.MutableClock;
import io.incentedge.webhooks.testing.RecordingMetrics;
import io.incentedge.webhooks.testing.RecordingTransport;
import io.incentedge.webhooks.testing.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryEngineTest {
  private final MutableClock clock = MutableClock.at("2026-02-01T08:00:00Z");
  private final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();
  private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingTransport transport = RecordingTransport.respondingWith(200);

  private Subscription subscription;

  @BeforeEach
  void setUp() {
    subscription = Fixtures.subscription("sub_1", "project.created")
        .customHeaders(Map.of("Authorization", "Bearer token"))
        .maxRetries(2)
        .build();
    subscriptions.put(subscription);
  }

  private DeliveryEngine engine() {
    return DeliveryEngine.builder()
        .connectionProvider(StubConnections.noop())
        .deliveryStore(deliveries)
        .subscriptionStore(subscriptions)
        .transport(transport)
        .retryPolicy(attempt -> 1_000L * (attempt + 1))
        .metrics(metrics)
        .timeout(Duration.ofSeconds(5))
        .clock(clock)
        .build();
  }

  private DeliveryRecord sending(String id, int attemptCount) {
    DeliveryRecord record = Fixtures.record(id, subscription, clock.instant())
        .status(DeliveryStatus.SENDING)
        .attemptCount(attemptCount)
        .lockedAt(clock.instant())
        .build();
    deliveries.put(record);
    return record;
  }

  // ── Builder validation ───────────────────────────────────────

  @Test
  void requiredCollaboratorsChecked() {
    assertThrows(NullPointerException.class, () -> DeliveryEngine.builder()
        .deliveryStore(deliveries).subscriptionStore(subscriptions).build());
    assertThrows(IllegalArgumentException.class, () -> DeliveryEngine.builder()
        .connectionProvider(StubConnections.noop())
        .deliveryStore(deliveries).subscriptionStore(subscriptions)
        .timeout(Duration.ZERO).build());
  }

  // ── Success ──────────────────────────────────────────────────

  @Test
  void successfulAttemptMarksDelivered() {
    DeliveryRecord record = sending("d1", 0);

    DeliveryOutcome outcome = engine().attempt(subscription, record);

    assertTrue(outcome.isSuccess());
    assertEquals(1, outcome.attemptCount());
    DeliveryRecord stored = deliveries.get("d1");
    assertEquals(DeliveryStatus.DELIVERED, stored.status());
    assertEquals(1, stored.attemptCount());
    assertEquals(200, stored.responseStatusCode());
    assertEquals("ok", stored.responseBody());
    assertNotNull(stored.deliveredAt());
    assertNull(stored.lockedAt());
    assertNull(stored.errorMessage());
    assertEquals(1, metrics.success.get());

    Subscription updated = subscriptions.get("sub_1");
    assertEquals(1, updated.successCount());
    assertEquals(clock.instant(), updated.lastSuccessAt());
    assertEquals(clock.instant(), updated.lastTriggeredAt());
  }

  @Test
  void requestCarriesStoredBytesAndVerifiableSignature() {
    DeliveryRecord record = sending("d1", 0);

    engine().attempt(subscription, record);

    WebhookRequest request = transport.lastRequest();
    assertEquals(subscription.url(), request.uri().toString());
    assertArrayEquals(record.payloadJson().getBytes(StandardCharsets.UTF_8), request.body());
    assertEquals("Bearer token", request.header("Authorization"));
    assertEquals("application/json", request.header("content-type"));
    assertEquals("IncentEdge-Webhook/1.0", request.header("User-Agent"));
    assertEquals("project.created", request.header("X-IncentEdge-Event"));
    assertEquals(record.eventId(), request.header("X-IncentEdge-Delivery"));
    assertEquals(Duration.ofSeconds(5), request.timeout());

    WebhookSigner verifier = new WebhookSigner(clock, WebhookSigner.DEFAULT_TOLERANCE);
    assertTrue(verifier.verify(request.body(), request.header("X-IncentEdge-Signature"),
        subscription.secret()).valid());
  }

  // ── Failure with attempts remaining ─────────────────────────

  @Test
  void non2xxSchedulesRetryWithBackoff() {
    transport.setResponder(request -> new WebhookResponse(503, Map.of("Retry-After", "30"), "busy"));
    DeliveryRecord record = sending("d1", 0);

    DeliveryOutcome outcome = engine().attempt(subscription, record);

    DeliveryOutcome.Failed failed = assertInstanceOf(DeliveryOutcome.Failed.class, outcome);
    assertEquals(DeliveryStatus.RETRYING, failed.status());
    assertEquals(new DeliveryFailure.HttpStatus(503), failed.failure());
    assertEquals(clock.instant().plusMillis(1_000), failed.nextRetryAt());

    DeliveryRecord stored = deliveries.get("d1");
    assertEquals(DeliveryStatus.RETRYING, stored.status());
    assertEquals(1, stored.attemptCount());
    assertEquals("HTTP 503", stored.errorMessage());
    assertEquals("busy", stored.responseBody());
    assertEquals("30", stored.responseHeaders().get("Retry-After"));
    assertEquals(failed.nextRetryAt(), stored.nextRetryAt());
    assertNotNull(stored.failedAt());
    assertEquals(1, metrics.retry.get());
    assertEquals(1, subscriptions.get("sub_1").failureCount());
  }

  @Test
  void backoffUsesAttemptsAlreadyMade() {
    transport.setResponder(request -> new WebhookResponse(500, Map.of(), ""));
    DeliveryRecord record = sending("d1", 1);

    DeliveryOutcome.Failed failed = (DeliveryOutcome.Failed) engine().attempt(subscription, record);

    assertEquals(DeliveryStatus.RETRYING, failed.status());
    assertEquals(2, failed.attemptCount());
    assertEquals(clock.instant().plusMillis(2_000), failed.nextRetryAt());
  }

  @Test
  void timeoutIsRecordedAsTimeoutFailure() {
    transport.setResponder(request -> {
      throw new HttpTimeoutException("request timed out");
    });
    DeliveryRecord record = sending("d1", 0);

    DeliveryOutcome.Failed failed = (DeliveryOutcome.Failed) engine().attempt(subscription, record);

    assertEquals(new DeliveryFailure.Timeout(5_000), failed.failure());
    DeliveryRecord stored = deliveries.get("d1");
    assertEquals("Request timed out after 5000ms", stored.errorMessage());
    assertNull(stored.responseStatusCode());
  }

  @Test
  void connectionErrorIsRecordedAsTransportFailure() {
    transport.setResponder(request -> {
      throw new ConnectException("Connection refused");
    });
    DeliveryRecord record = sending("d1", 0);

    DeliveryOutcome.Failed failed = (DeliveryOutcome.Failed) engine().attempt(subscription, record);

    assertEquals(new DeliveryFailure.TransportError("Connection refused"), failed.failure());
    assertEquals(DeliveryStatus.RETRYING, deliveries.get("d1").status());
  }

  @Test
  void invalidUrlIsAFailedAttempt() {
    subscription = subscription.toBuilder().url("https://bad host/with spaces").build();
    DeliveryRecord record = sending("d1", 0);

    DeliveryOutcome outcome = engine().attempt(subscription, record);

    assertFalse(outcome.isSuccess());
    assertTrue(transport.requests().isEmpty());
    assertEquals(DeliveryStatus.RETRYING, deliveries.get("d1").status());
  }

  // ── Exhaustion ───────────────────────────────────────────────

  @Test
  void lastAllowedAttemptFailingExhausts() {
    transport.setResponder(request -> new WebhookResponse(410, Map.of(), "gone"));
    DeliveryRecord record = sending("d1", 2);

    DeliveryOutcome.Failed failed = (DeliveryOutcome.Failed) engine().attempt(subscription, record);

    assertEquals(DeliveryStatus.EXHAUSTED, failed.status());
    assertEquals(3, failed.attemptCount());
    assertNull(failed.nextRetryAt());
    DeliveryRecord stored = deliveries.get("d1");
    assertEquals(DeliveryStatus.EXHAUSTED, stored.status());
    assertEquals(3, stored.attemptCount());
    assertNull(stored.nextRetryAt());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void singleAttemptRecordExhaustsImmediately() {
    transport.setResponder(request -> new WebhookResponse(500, Map.of(), ""));
    DeliveryRecord record = Fixtures.record("d1", subscription, clock.instant())
        .status(DeliveryStatus.SENDING)
        .maxAttempts(1)
        .build();
    deliveries.put(record);

    DeliveryOutcome outcome = engine().attempt(subscription, record);

    assertEquals(DeliveryStatus.EXHAUSTED, outcome.status());
  }

  // ── Persistence ──────────────────────────────────────────────

  @Test
  void recordNoLongerSendingIsLeftAlone() {
    DeliveryRecord record = sending("d1", 0);
    deliveries.put(record.toBuilder().status(DeliveryStatus.DELIVERED).build());

    engine().attempt(subscription, record);

    assertEquals(DeliveryStatus.DELIVERED, deliveries.get("d1").status());
    assertEquals(0, deliveries.get("d1").attemptCount());
    assertEquals(0, subscriptions.get("sub_1").successCount());
  }

  @Test
  void unavailableDatabaseLeavesRecordSending() {
    DeliveryRecord record = sending("d1", 0);
    DeliveryEngine engine = DeliveryEngine.builder()
        .connectionProvider(StubConnections.failing())
        .deliveryStore(deliveries)
        .subscriptionStore(subscriptions)
        .transport(transport)
        .clock(clock)
        .build();

    DeliveryOutcome outcome = engine.attempt(subscription, record);

    assertTrue(outcome.isSuccess());
    assertEquals(DeliveryStatus.SENDING, deliveries.get("d1").status());
    assertEquals(Instant.parse("2026-02-01T08:00:00Z"), deliveries.get("d1").lockedAt());
  }
}
