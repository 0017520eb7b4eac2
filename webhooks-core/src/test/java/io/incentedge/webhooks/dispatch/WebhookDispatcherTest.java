package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.EnvelopeFormatter;
import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.WebhookEventType;
import io.incentedge.webhooks.WebhookResolutionException;
import io.incentedge.webhooks.delivery.DeliveryEngine;
import io.incentedge.webhooks.filter.FilterCriteria;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.WebhookRequest;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.testing.Fixtures;
import io.incentedge.webhooks.testing.InMemoryDeliveryStore;
import io.incentedge.webhooks.testing.InMemorySubscriptionStore;
import io.incentedge.webhooks.testing.MutableClock;
import io.incentedge.webhooks.testing.RecordingMetrics;
import io.incentedge.webhooks.testing.RecordingTransport;
import io.incentedge.webhooks.testing.StubConnections;
import io.incentedge.webhooks.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WebhookDispatcherTest {
  private final MutableClock clock = MutableClock.at("2026-02-01T08:00:00Z");
  private final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();
  private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingTransport transport = RecordingTransport.respondingWith(200);
  private WebhookDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    subscriptions.put(Fixtures.subscription("sub_a", "application.submitted").build());
    subscriptions.put(Fixtures.subscription("sub_b", "application.submitted", "project.created").build());
    subscriptions.put(Fixtures.subscription("sub_c", "application.submitted")
        .filters(FilterCriteria.builder().minValue(100_000).build())
        .build());
    dispatcher = dispatcher(StubConnections.noop(), 2);
  }

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  private WebhookDispatcher dispatcher(ConnectionProvider provider, int workers) {
    DeliveryEngine engine = DeliveryEngine.builder()
        .connectionProvider(provider)
        .deliveryStore(deliveries)
        .subscriptionStore(subscriptions)
        .transport(transport)
        .metrics(metrics)
        .clock(clock)
        .build();
    return WebhookDispatcher.builder()
        .connectionProvider(provider)
        .subscriptionStore(subscriptions)
        .deliveryStore(deliveries)
        .engine(engine)
        .formatter(new EnvelopeFormatter(JsonCodec.getDefault(), EventEnvelope.DEFAULT_API_VERSION, clock))
        .metrics(metrics)
        .clock(clock)
        .workerCount(workers)
        .build();
  }

  private static Map<String, Object> application(long amount) {
    return Map.of("application_id", "app_1", "project_id", "p1", "amount_requested", amount);
  }

  // ── Queued dispatch ──────────────────────────────────────────

  @Test
  void createsOneRecordPerMatchingSubscription() {
    DispatchResult result = dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED,
        application(25_000), Fixtures.ORG, null);

    assertEquals(2, result.recordsCreated());
    assertFalse(result.hasErrors());
    assertTrue(result.outcomes().isEmpty());
    Set<String> targets = deliveries.all().stream().map(DeliveryRecord::subscriptionId).collect(Collectors.toSet());
    assertEquals(Set.of("sub_a", "sub_b"), targets);
    assertEquals(1, metrics.filtered.get());
    assertEquals(2, metrics.recordsCreated.get());
    assertTrue(transport.requests().isEmpty());
  }

  @Test
  void queuedRecordsStartPendingWithSubscriptionBudget() {
    subscriptions.put(Fixtures.subscription("sub_a", "application.submitted").maxRetries(5).build());

    DispatchResult result = dispatcher.dispatch("application.submitted", application(1), Fixtures.ORG,
        DispatchOptions.builder().applicationId("app_1").projectId("p1").build());

    DeliveryRecord record = deliveries.all().stream()
        .filter(r -> r.subscriptionId().equals("sub_a")).findFirst().orElseThrow();
    assertEquals(DeliveryStatus.PENDING, record.status());
    assertEquals(0, record.attemptCount());
    assertEquals(6, record.maxAttempts());
    assertEquals(result.eventId(), record.eventId());
    assertEquals("app_1", record.applicationId());
    assertEquals("p1", record.projectId());
    assertEquals(clock.instant(), record.scheduledAt());
    assertNull(record.lockedAt());
    assertEquals("https://hooks.example.com/sub_a", record.requestUrl());
  }

  @Test
  void everyRecordStoresIdenticalPayload() {
    dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(25_000), Fixtures.ORG, null);

    List<DeliveryRecord> records = deliveries.all();
    assertEquals(2, records.size());
    assertEquals(records.get(0).payloadJson(), records.get(1).payloadJson());
    assertEquals(records.get(0).payloadHash(), records.get(1).payloadHash());
    assertEquals(DeliveryRecord.sha256Hex(records.get(0).payloadJson()), records.get(0).payloadHash());
  }

  @Test
  void envelopeCarriesQueueMetadata() {
    dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(25_000), Fixtures.ORG,
        DispatchOptions.builder().userId("u1").userEmail("u1@example.com").ipAddress("10.0.0.1").build());

    EventEnvelope envelope = JsonCodec.getDefault()
        .fromJson(deliveries.all().get(0).payloadJson(), EventEnvelope.class);
    assertEquals("application.submitted", envelope.event());
    assertEquals(Fixtures.ORG, envelope.organizationId());
    assertEquals("u1", envelope.metadata().userId());
    assertEquals("10.0.0.1", envelope.metadata().ipAddress());
    assertEquals("queue", envelope.metadata().triggeredBy());
  }

  @Test
  void noSubscribersCreatesNothing() {
    DispatchResult result = dispatcher.dispatch(WebhookEventType.DEADLINE_PASSED, Map.of(), Fixtures.ORG, null);

    assertEquals(0, result.recordsCreated());
    assertNotNull(result.eventId());
    assertTrue(deliveries.all().isEmpty());
  }

  @Test
  void otherOrganizationsAndInactiveSubscriptionsIgnored() {
    subscriptions.put(Fixtures.subscription("sub_x", "project.created").organizationId("org_other").build());
    subscriptions.put(Fixtures.subscription("sub_y", "project.created").active(false).build());

    DispatchResult result = dispatcher.dispatch(WebhookEventType.PROJECT_CREATED,
        Map.of("project_id", "p1"), Fixtures.ORG, null);

    assertEquals(1, result.recordsCreated());
    assertEquals("sub_b", deliveries.all().get(0).subscriptionId());
  }

  // ── Failure isolation ────────────────────────────────────────

  @Test
  void insertFailureForOneSubscriberDoesNotStopOthers() {
    deliveries.failInsertsFor("sub_a");

    DispatchResult result = dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED,
        application(25_000), Fixtures.ORG, null);

    assertEquals(1, result.recordsCreated());
    assertEquals(1, result.errors().size());
    DispatchError error = result.errors().get(0);
    assertEquals("sub_a", error.subscriptionId());
    assertTrue(error.message().startsWith("Failed to queue event: "), error.message());
    assertEquals("sub_b", deliveries.all().get(0).subscriptionId());
  }

  @Test
  void resolutionFailureIsThrown() {
    subscriptions.setUnavailable(true);

    WebhookResolutionException e = assertThrows(WebhookResolutionException.class,
        () -> dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(1), Fixtures.ORG, null));
    assertEquals(Fixtures.ORG, e.organizationId());
    assertEquals("application.submitted", e.eventType());
  }

  @Test
  void unavailableDatabaseIsResolutionFailure() {
    try (var failing = dispatcher(StubConnections.failing(), 0)) {
      assertThrows(WebhookResolutionException.class,
          () -> failing.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(1), Fixtures.ORG, null));
    }
  }

  // ── Immediate dispatch ───────────────────────────────────────

  @Test
  void immediateDispatchSendsBeforeReturning() {
    DispatchResult result = dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(25_000),
        Fixtures.ORG, DispatchOptions.builder().immediate(true).build());

    assertEquals(2, result.outcomes().size());
    assertTrue(result.outcomes().stream().allMatch(o -> o.isSuccess()));
    assertEquals(2, transport.requests().size());
    assertTrue(deliveries.all().stream().allMatch(r -> r.status() == DeliveryStatus.DELIVERED));

    EventEnvelope envelope = JsonCodec.getDefault()
        .fromJson(deliveries.all().get(0).payloadJson(), EventEnvelope.class);
    assertEquals("immediate", envelope.metadata().triggeredBy());
  }

  @Test
  void immediateRecipientsReceiveIdenticalBytes() {
    dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(25_000), Fixtures.ORG,
        DispatchOptions.builder().immediate(true).build());

    List<WebhookRequest> requests = transport.requests();
    assertEquals(2, requests.size());
    assertTrue(Arrays.equals(requests.get(0).body(), requests.get(1).body()));
    assertEquals(requests.get(0).header("X-IncentEdge-Delivery"), requests.get(1).header("X-IncentEdge-Delivery"));
  }

  @Test
  void immediateFailureIsRecordedForRetry() {
    transport.setResponder(request -> request.uri().getPath().endsWith("sub_a")
        ? new WebhookResponse(500, Map.of(), "") : new WebhookResponse(200, Map.of(), ""));

    DispatchResult result = dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, application(25_000),
        Fixtures.ORG, DispatchOptions.builder().immediate(true).build());

    assertEquals(2, result.recordsCreated());
    assertFalse(result.hasErrors());
    Map<String, DeliveryStatus> statuses = deliveries.all().stream()
        .collect(Collectors.toMap(DeliveryRecord::subscriptionId, DeliveryRecord::status));
    assertEquals(DeliveryStatus.RETRYING, statuses.get("sub_a"));
    assertEquals(DeliveryStatus.DELIVERED, statuses.get("sub_b"));
  }

  @Test
  void inlineWorkerModeSendsOnCallerThread() {
    try (var inline = dispatcher(StubConnections.noop(), 0)) {
      DispatchResult result = inline.dispatch(WebhookEventType.PROJECT_CREATED, Map.of("project_id", "p1"),
          Fixtures.ORG, DispatchOptions.builder().immediate(true).build());

      assertEquals(1, result.outcomes().size());
      assertTrue(result.outcomes().get(0).isSuccess());
    }
  }

  // ── Argument and lifecycle checks ────────────────────────────

  @Test
  void blankEventTypeRejected() {
    assertThrows(IllegalArgumentException.class, () -> dispatcher.dispatch(" ", Map.of(), Fixtures.ORG, null));
  }

  @Test
  void closedDispatcherRejectsEvents() {
    dispatcher.close();

    assertThrows(IllegalStateException.class,
        () -> dispatcher.dispatch(WebhookEventType.PROJECT_CREATED, Map.of(), Fixtures.ORG, null));
  }

  @Test
  void negativeWorkerCountRejected() {
    assertThrows(IllegalArgumentException.class, () -> dispatcher(StubConnections.noop(), -1));
  }
}
