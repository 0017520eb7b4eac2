package io.incentedge.webhooks.exhausted;

import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.testing.Fixtures;
import io.incentedge.webhooks.testing.InMemoryDeliveryStore;
import io.incentedge.webhooks.testing.MutableClock;
import io.incentedge.webhooks.testing.StubConnections;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExhaustedDeliveryManagerTest {
  private final MutableClock clock = MutableClock.at("2026-02-01T08:00:00Z");
  private final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();
  private final Subscription subA = Fixtures.subscription("sub_a", "project.created").build();
  private final Subscription subB = Fixtures.subscription("sub_b", "project.created").build();
  private final ExhaustedDeliveryManager manager =
      new ExhaustedDeliveryManager(StubConnections.noop(), deliveries, clock);

  private DeliveryRecord exhausted(String id, Subscription subscription) {
    DeliveryRecord record = Fixtures.record(id, subscription, clock.instant())
        .status(DeliveryStatus.EXHAUSTED)
        .attemptCount(subscription.maxAttempts())
        .errorMessage("HTTP 500")
        .build();
    deliveries.put(record);
    clock.advance(Duration.ofSeconds(1));
    return record;
  }

  @Test
  void queryFiltersBySubscription() {
    exhausted("d1", subA);
    exhausted("d2", subB);
    exhausted("d3", subA);

    List<DeliveryRecord> result = manager.query("sub_a", null, 10);

    assertEquals(List.of("d1", "d3"), result.stream().map(DeliveryRecord::id).toList());
    assertEquals("HTTP 500", result.get(0).errorMessage());
    assertEquals(3, manager.query(null, null, 10).size());
    assertEquals(1, manager.query(null, null, 1).size());
  }

  @Test
  void replayCreatesFreshPendingRecord() {
    DeliveryRecord original = exhausted("d1", subA);

    Optional<DeliveryRecord> replay = manager.replay("d1");

    assertTrue(replay.isPresent());
    DeliveryRecord copy = replay.get();
    assertNotEquals("d1", copy.id());
    assertEquals("d1", copy.replayOf());
    assertEquals(DeliveryStatus.PENDING, copy.status());
    assertEquals(0, copy.attemptCount());
    assertEquals(original.maxAttempts(), copy.maxAttempts());
    assertEquals(original.eventId(), copy.eventId());
    assertEquals(original.payloadJson(), copy.payloadJson());
    assertEquals(original.payloadHash(), copy.payloadHash());
    assertEquals(clock.instant(), copy.scheduledAt());
    assertSame(copy, deliveries.get(copy.id()));
    assertEquals(DeliveryStatus.EXHAUSTED, deliveries.get("d1").status());
  }

  @Test
  void replayIgnoresUnknownAndNonExhausted() {
    deliveries.put(Fixtures.record("d1", subA, clock.instant()).status(DeliveryStatus.RETRYING).build());

    assertTrue(manager.replay("d1").isEmpty());
    assertTrue(manager.replay("nope").isEmpty());
    assertEquals(1, deliveries.all().size());
  }

  @Test
  void replayAllProcessesEveryBatchOnce() {
    for (int i = 0; i < 5; i++) {
      exhausted("d" + i, subA);
    }
    exhausted("other", subB);

    int replayed = manager.replayAll("sub_a", null, 2);

    assertEquals(5, replayed);
    assertEquals(5, deliveries.withStatus(DeliveryStatus.PENDING).size());
    // already replayed records are skipped on a second pass
    assertEquals(0, manager.replayAll("sub_a", null, 2));
  }

  @Test
  void replayAllRejectsNonPositiveBatch() {
    assertThrows(IllegalArgumentException.class, () -> manager.replayAll(null, null, 0));
  }

  @Test
  void countDelegates() {
    exhausted("d1", subA);
    exhausted("d2", subB);

    assertEquals(2, manager.count(null));
    assertEquals(1, manager.count("sub_b"));
  }

  @Test
  void connectionFailureReturnsEmpty() {
    ExhaustedDeliveryManager failing = new ExhaustedDeliveryManager(StubConnections.failing(), deliveries);

    assertTrue(failing.query(null, null, 10).isEmpty());
    assertTrue(failing.replay("d1").isEmpty());
    assertEquals(0, failing.replayAll(null, null, 10));
    assertEquals(0, failing.count(null));
  }
}
