package io.incentedge.webhooks.signature;

import java.util.Objects;

/**
 * Thrown by {@link WebhookSigner#verifyOrThrow} when a signature is rejected.
 */
public final class WebhookSignatureException extends RuntimeException {
  private final SignatureFailure failure;

  public WebhookSignatureException(SignatureFailure failure) {
    super("Webhook signature rejected: " + Objects.requireNonNull(failure, "failure"));
    this.failure = failure;
  }

  public SignatureFailure failure() {
    return failure;
  }
}
