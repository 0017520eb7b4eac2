package io.incentedge.webhooks.testing;

import io.incentedge.webhooks.model.DeliveryAttempt;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStats;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link DeliveryStore} with the same conditional-update semantics as the JDBC
 * stores. Inserts for subscriptions listed in {@link #failInsertsFor} throw.
 */
public class InMemoryDeliveryStore implements DeliveryStore {
  private final Map<String, DeliveryRecord> records = new LinkedHashMap<>();
  private final Set<String> failInsertsFor = new HashSet<>();
  public final AtomicInteger recordAttemptCalls = new AtomicInteger();
  private volatile boolean claimUnavailable;

  public synchronized void failInsertsFor(String subscriptionId) {
    failInsertsFor.add(subscriptionId);
  }

  public void setClaimUnavailable(boolean claimUnavailable) {
    this.claimUnavailable = claimUnavailable;
  }

  public synchronized DeliveryRecord get(String id) {
    return records.get(id);
  }

  public synchronized void put(DeliveryRecord record) {
    records.put(record.id(), record);
  }

  public synchronized List<DeliveryRecord> all() {
    return new ArrayList<>(records.values());
  }

  public synchronized List<DeliveryRecord> withStatus(DeliveryStatus status) {
    List<DeliveryRecord> result = new ArrayList<>();
    for (DeliveryRecord r : records.values()) {
      if (r.status() == status) {
        result.add(r);
      }
    }
    return result;
  }

  @Override
  public synchronized void insertNew(Connection conn, DeliveryRecord record) {
    if (failInsertsFor.contains(record.subscriptionId())) {
      throw new IllegalStateException("insert rejected for " + record.subscriptionId());
    }
    if (records.containsKey(record.id())) {
      throw new IllegalStateException("Duplicate delivery id " + record.id());
    }
    records.put(record.id(), record);
  }

  @Override
  public synchronized Optional<DeliveryRecord> findById(Connection conn, String id) {
    return Optional.ofNullable(records.get(id));
  }

  @Override
  public synchronized List<DeliveryRecord> findByEventId(Connection conn, String eventId) {
    List<DeliveryRecord> result = new ArrayList<>();
    for (DeliveryRecord r : records.values()) {
      if (r.eventId().equals(eventId)) {
        result.add(r);
      }
    }
    return result;
  }

  @Override
  public synchronized List<DeliveryRecord> claimDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    if (claimUnavailable) {
      throw new IllegalStateException("delivery table unavailable");
    }
    List<DeliveryRecord> due = new ArrayList<>();
    for (DeliveryRecord r : records.values()) {
      if (isDue(r, now, lockExpiry)) {
        due.add(r);
      }
    }
    due.sort(Comparator.comparing(InMemoryDeliveryStore::dueAt));
    List<DeliveryRecord> claimed = new ArrayList<>();
    for (DeliveryRecord r : due.subList(0, Math.min(limit, due.size()))) {
      DeliveryRecord updated = r.toBuilder().status(DeliveryStatus.SENDING).lockedAt(now).build();
      records.put(r.id(), updated);
      claimed.add(updated);
    }
    return claimed;
  }

  private static boolean isDue(DeliveryRecord r, Instant now, Instant lockExpiry) {
    switch (r.status()) {
      case PENDING:
        return !r.scheduledAt().isAfter(now);
      case RETRYING:
        return r.nextRetryAt() != null && !r.nextRetryAt().isAfter(now);
      case SENDING:
        return r.lockedAt() != null && r.lockedAt().isBefore(lockExpiry);
      default:
        return false;
    }
  }

  private static Instant dueAt(DeliveryRecord r) {
    return r.nextRetryAt() != null ? r.nextRetryAt() : r.scheduledAt();
  }

  @Override
  public synchronized int recordAttempt(Connection conn, String id, DeliveryAttempt attempt) {
    recordAttemptCalls.incrementAndGet();
    DeliveryRecord r = records.get(id);
    if (r == null || r.status() != DeliveryStatus.SENDING) {
      return 0;
    }
    boolean delivered = attempt.newStatus() == DeliveryStatus.DELIVERED;
    DeliveryRecord updated = r.toBuilder()
        .status(attempt.newStatus())
        .attemptCount(r.attemptCount() + 1)
        .nextRetryAt(attempt.nextRetryAt())
        .responseStatusCode(attempt.responseStatusCode())
        .responseHeaders(attempt.responseHeaders())
        .responseBody(attempt.responseBody())
        .responseTimeMs(attempt.responseTimeMs())
        .errorMessage(attempt.errorMessage())
        .sentAt(attempt.attemptedAt())
        .deliveredAt(delivered ? attempt.completedAt() : r.deliveredAt())
        .failedAt(delivered ? r.failedAt() : attempt.completedAt())
        .lockedAt(null)
        .build();
    records.put(id, updated);
    return 1;
  }

  @Override
  public synchronized int markExhausted(Connection conn, String id, String error, Instant at) {
    DeliveryRecord r = records.get(id);
    if (r == null || r.status() != DeliveryStatus.SENDING) {
      return 0;
    }
    records.put(id, r.toBuilder()
        .status(DeliveryStatus.EXHAUSTED)
        .errorMessage(error)
        .failedAt(at)
        .nextRetryAt(null)
        .lockedAt(null)
        .build());
    return 1;
  }

  @Override
  public synchronized List<DeliveryRecord> queryExhausted(Connection conn, String subscriptionId,
      String eventType, boolean excludeReplayed, int limit) {
    Set<String> replayed = new HashSet<>();
    for (DeliveryRecord r : records.values()) {
      if (r.replayOf() != null) {
        replayed.add(r.replayOf());
      }
    }
    List<DeliveryRecord> result = new ArrayList<>();
    for (DeliveryRecord r : records.values()) {
      if (r.status() == DeliveryStatus.EXHAUSTED
          && (subscriptionId == null || subscriptionId.equals(r.subscriptionId()))
          && (eventType == null || eventType.equals(r.eventType()))
          && (!excludeReplayed || !replayed.contains(r.id()))) {
        result.add(r);
      }
    }
    return result.subList(0, Math.min(limit, result.size()));
  }

  @Override
  public synchronized long countExhausted(Connection conn, String subscriptionId) {
    return records.values().stream()
        .filter(r -> r.status() == DeliveryStatus.EXHAUSTED)
        .filter(r -> subscriptionId == null || subscriptionId.equals(r.subscriptionId()))
        .count();
  }

  @Override
  public synchronized DeliveryStats statsSince(Connection conn, String subscriptionId, Instant since) {
    long total = 0;
    long delivered = 0;
    long failed = 0;
    for (DeliveryRecord r : records.values()) {
      if (!r.subscriptionId().equals(subscriptionId) || r.createdAt().isBefore(since)) {
        continue;
      }
      total++;
      if (r.status() == DeliveryStatus.DELIVERED) {
        delivered++;
      } else if (r.status() == DeliveryStatus.FAILED || r.status() == DeliveryStatus.EXHAUSTED) {
        failed++;
      }
    }
    return new DeliveryStats(total, delivered, failed);
  }
}
