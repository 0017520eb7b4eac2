/**
 * Sending signed webhook requests and recording each attempt.
 *
 * <p>{@link io.incentedge.webhooks.delivery.DeliveryEngine} owns the attempt lifecycle;
 * {@link io.incentedge.webhooks.delivery.HttpClientWebhookTransport} is the default wire.
 */
package io.incentedge.webhooks.delivery;
