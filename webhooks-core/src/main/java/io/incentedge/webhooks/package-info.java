/**
 * Webhook event dispatch with signed, reliable delivery.
 *
 * <p>Producers call {@link io.incentedge.webhooks.dispatch.WebhookDispatcher#dispatch} to
 * fan an event out to the matching subscriptions of an organization; each subscription
 * gets a persisted delivery record that is retried with exponential backoff until it is
 * delivered or exhausted. {@link io.incentedge.webhooks.Webhooks} wires the pieces together.
 *
 * @see io.incentedge.webhooks.Webhooks
 * @see io.incentedge.webhooks.EventEnvelope
 */
package io.incentedge.webhooks;
