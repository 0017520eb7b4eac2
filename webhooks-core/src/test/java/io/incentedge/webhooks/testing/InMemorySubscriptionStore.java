package io.incentedge.webhooks.testing;

import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.SubscriptionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link SubscriptionStore} for unit tests.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {
  private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
  private volatile boolean unavailable;

  public void setUnavailable(boolean unavailable) {
    this.unavailable = unavailable;
  }

  public synchronized Subscription get(String id) {
    return subscriptions.get(id);
  }

  public synchronized void put(Subscription subscription) {
    subscriptions.put(subscription.id(), subscription);
  }

  public synchronized void remove(String id) {
    subscriptions.remove(id);
  }

  @Override
  public synchronized void insert(Connection conn, Subscription subscription) {
    checkAvailable();
    if (subscriptions.containsKey(subscription.id())) {
      throw new IllegalStateException("Duplicate subscription id " + subscription.id());
    }
    subscriptions.put(subscription.id(), subscription);
  }

  @Override
  public synchronized Optional<Subscription> findById(Connection conn, String id) {
    checkAvailable();
    return Optional.ofNullable(subscriptions.get(id));
  }

  @Override
  public synchronized List<Subscription> findActiveByEventType(Connection conn, String organizationId,
      String eventType) {
    checkAvailable();
    List<Subscription> result = new ArrayList<>();
    for (Subscription s : subscriptions.values()) {
      if (s.active() && s.organizationId().equals(organizationId) && s.subscribesTo(eventType)) {
        result.add(s);
      }
    }
    return result;
  }

  @Override
  public synchronized List<Subscription> findByOrganization(Connection conn, String organizationId) {
    checkAvailable();
    List<Subscription> result = new ArrayList<>();
    for (Subscription s : subscriptions.values()) {
      if (s.organizationId().equals(organizationId)) {
        result.add(s);
      }
    }
    result.sort(Comparator.comparing(Subscription::createdAt).reversed());
    return result;
  }

  @Override
  public synchronized int markTriggered(Connection conn, String id, Instant at, boolean success) {
    Subscription s = subscriptions.get(id);
    if (s == null) {
      return 0;
    }
    Subscription.Builder b = s.toBuilder().lastTriggeredAt(at);
    if (success) {
      b.lastSuccessAt(at).successCount(s.successCount() + 1);
    } else {
      b.lastFailureAt(at).failureCount(s.failureCount() + 1);
    }
    subscriptions.put(id, b.build());
    return 1;
  }

  @Override
  public synchronized int setActive(Connection conn, String id, boolean active) {
    Subscription s = subscriptions.get(id);
    if (s == null) {
      return 0;
    }
    subscriptions.put(id, s.toBuilder().active(active).build());
    return 1;
  }

  @Override
  public synchronized int updateSecret(Connection conn, String id, String secret) {
    Subscription s = subscriptions.get(id);
    if (s == null) {
      return 0;
    }
    subscriptions.put(id, s.toBuilder().secret(secret).build());
    return 1;
  }

  private void checkAvailable() {
    if (unavailable) {
      throw new IllegalStateException("subscription table unavailable");
    }
  }
}
