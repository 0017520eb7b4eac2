/**
 * Per-subscription event filters.
 */
package io.incentedge.webhooks.filter;
