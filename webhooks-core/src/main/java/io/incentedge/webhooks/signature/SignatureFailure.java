package io.incentedge.webhooks.signature;

/**
 * Reasons an inbound signature is rejected. None of these are retryable; the receiver
 * must reject the request.
 */
public enum SignatureFailure {
  /** The header lacks a {@code t=} or {@code v1=} component, or a component is unparseable. */
  MALFORMED_SIGNATURE,
  /** The embedded timestamp is outside the tolerance window. */
  STALE_SIGNATURE,
  /** The MAC does not match the payload and secret. */
  SIGNATURE_MISMATCH
}
