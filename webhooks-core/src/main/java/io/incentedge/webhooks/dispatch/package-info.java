/**
 * Event fan-out: subscriber resolution, filter evaluation and delivery-record creation.
 *
 * @see io.incentedge.webhooks.dispatch.WebhookDispatcher
 */
package io.incentedge.webhooks.dispatch;
