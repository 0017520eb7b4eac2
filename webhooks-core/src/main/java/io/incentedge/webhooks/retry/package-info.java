/**
 * Backoff between delivery attempts.
 */
package io.incentedge.webhooks.retry;
