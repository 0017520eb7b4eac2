package io.incentedge.webhooks.testing;

import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;

import java.time.Instant;

/**
 * Builders for commonly needed test objects.
 */
public final class Fixtures {
  public static final String ORG = "org_acme";
  public static final String SECRET = "whsec_0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

  private Fixtures() {}

  public static Subscription.Builder subscription(String id, String... events) {
    return Subscription.builder()
        .id(id)
        .organizationId(ORG)
        .name("hook " + id)
        .url("https://hooks.example.com/" + id)
        .secret(SECRET)
        .events(events)
        .createdAt(Instant.parse("2026-01-01T00:00:00Z"));
  }

  public static DeliveryRecord.Builder record(String id, Subscription subscription, Instant createdAt) {
    return DeliveryRecord.builder()
        .id(id)
        .subscriptionId(subscription.id())
        .organizationId(subscription.organizationId())
        .eventId("evt_" + id)
        .eventType("project.created")
        .payloadJson("{\"id\":\"evt_" + id + "\",\"event\":\"project.created\"}")
        .status(DeliveryStatus.PENDING)
        .maxAttempts(subscription.maxAttempts())
        .requestUrl(subscription.url())
        .scheduledAt(createdAt)
        .createdAt(createdAt);
  }
}
