/**
 * Inspection and replay of deliveries that used up their attempts.
 */
package io.incentedge.webhooks.exhausted;
