package io.incentedge.webhooks.dispatch;

/**
 * A per-subscription failure collected during fan-out.
 *
 * @param subscriptionId the subscription that could not be served
 * @param message        what went wrong
 */
public record DispatchError(String subscriptionId, String message) {
  @Override
  public String toString() {
    return subscriptionId + ": " + message;
  }
}
