package io.incentedge.webhooks.jdbc;

import io.incentedge.webhooks.WebhookStorageException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in
 * {@link io.incentedge.webhooks.jdbc.store}.
 */
public final class DeliveryStoreException extends WebhookStorageException {
  public DeliveryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
