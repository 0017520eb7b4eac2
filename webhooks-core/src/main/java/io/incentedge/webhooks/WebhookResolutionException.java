package io.incentedge.webhooks;

/**
 * Thrown by {@link io.incentedge.webhooks.dispatch.WebhookDispatcher#dispatch} when the
 * subscribers of an event cannot be determined, typically because the datastore is
 * unavailable. No delivery records were created for the event.
 */
public final class WebhookResolutionException extends WebhookStorageException {
  private final String organizationId;
  private final String eventType;

  public WebhookResolutionException(String organizationId, String eventType, Throwable cause) {
    super("Failed to resolve subscribers for " + eventType + " in organization " + organizationId, cause);
    this.organizationId = organizationId;
    this.eventType = eventType;
  }

  public String organizationId() {
    return organizationId;
  }

  public String eventType() {
    return eventType;
  }
}
