package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.filter.EventFilter;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.SubscriptionStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the subscriptions an event should be delivered to.
 */
public final class SubscriptionResolver {
  private final SubscriptionStore subscriptionStore;

  public SubscriptionResolver(SubscriptionStore subscriptionStore) {
    this.subscriptionStore = Objects.requireNonNull(subscriptionStore, "subscriptionStore");
  }

  /**
   * Returns the organization's active subscriptions whose event set contains the type.
   *
   * @param conn           the JDBC connection
   * @param organizationId owning organization
   * @param eventType      event-type wire name
   * @return candidate subscriptions before filter evaluation
   */
  public List<Subscription> resolve(Connection conn, String organizationId, String eventType) {
    List<Subscription> found = subscriptionStore.findActiveByEventType(conn, organizationId, eventType);
    List<Subscription> result = new ArrayList<>(found.size());
    for (Subscription subscription : found) {
      if (subscription.active()
          && subscription.organizationId().equals(organizationId)
          && subscription.subscribesTo(eventType)) {
        result.add(subscription);
      }
    }
    return result;
  }

  /**
   * Whether the envelope's data passes the subscription's filters.
   */
  public boolean accepts(Subscription subscription, EventEnvelope envelope) {
    return EventFilter.matches(envelope.data(), subscription.filters());
  }
}
