package io.incentedge.webhooks;

/**
 * Unchecked wrapper for datastore failures surfaced by management operations
 * (subscription management, test delivery, exhausted-delivery replay).
 */
public class WebhookStorageException extends RuntimeException {
  public WebhookStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
