/**
 * Subscription administration: creation, secrets, activation and listing with stats.
 */
package io.incentedge.webhooks.subscription;
