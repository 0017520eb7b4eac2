/**
 * Shared helpers: the {@link io.incentedge.webhooks.util.JsonCodec} seam and its Jackson
 * implementation, ULID-based {@link io.incentedge.webhooks.util.Ids}, and a daemon
 * thread factory for worker pools and pollers.
 */
package io.incentedge.webhooks.util;
