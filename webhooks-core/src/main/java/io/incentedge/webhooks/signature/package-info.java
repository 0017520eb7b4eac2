/**
 * HMAC-SHA256 signing and verification of webhook payloads, and secret generation.
 *
 * @see io.incentedge.webhooks.signature.WebhookSigner
 */
package io.incentedge.webhooks.signature;
