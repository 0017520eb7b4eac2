/**
 * Spring Boot auto-configuration for IncentEdge webhooks.
 *
 * <p>{@link io.incentedge.webhooks.spring.boot.WebhookAutoConfiguration} wires an
 * {@link io.incentedge.webhooks.Webhooks} instance from {@code incentedge.webhooks.*}
 * application properties and exposes its dispatch and management facades as beans.
 *
 * @see io.incentedge.webhooks.spring.boot.WebhookAutoConfiguration
 * @see io.incentedge.webhooks.spring.boot.WebhookProperties
 */
package io.incentedge.webhooks.spring.boot;
