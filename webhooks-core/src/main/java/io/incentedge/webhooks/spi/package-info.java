/**
 * Service Provider Interfaces (SPI) for plugging in persistence, HTTP transport and metrics.
 *
 * @see io.incentedge.webhooks.spi.ConnectionProvider
 * @see io.incentedge.webhooks.spi.SubscriptionStore
 * @see io.incentedge.webhooks.spi.DeliveryStore
 * @see io.incentedge.webhooks.spi.WebhookTransport
 * @see io.incentedge.webhooks.spi.MetricsExporter
 */
package io.incentedge.webhooks.spi;
