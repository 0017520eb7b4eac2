package io.incentedge.webhooks.subscription;

import io.incentedge.webhooks.model.Subscription;

/**
 * A newly created subscription together with its secret. This is the only time the full
 * secret is handed out.
 */
public record CreatedSubscription(Subscription subscription, String secret) {
  @Override
  public String toString() {
    return "CreatedSubscription{" + subscription + '}';
  }
}
