package io.incentedge.webhooks.subscription;

import io.incentedge.webhooks.model.DeliveryStats;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.signature.WebhookSecrets;

/**
 * A subscription as listed for display, with its masked secret and recent delivery counts.
 */
public record SubscriptionSummary(Subscription subscription, DeliveryStats last24Hours) {

  public String maskedSecret() {
    return WebhookSecrets.mask(subscription.secret());
  }
}
