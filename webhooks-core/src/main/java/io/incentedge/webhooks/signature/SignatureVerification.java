package io.incentedge.webhooks.signature;

/**
 * Outcome of {@link WebhookSigner#verify}.
 *
 * @param valid   whether the signature was accepted
 * @param failure the rejection reason, {@code null} when valid
 */
public record SignatureVerification(boolean valid, SignatureFailure failure) {
  private static final SignatureVerification VALID = new SignatureVerification(true, null);

  public SignatureVerification {
    if (valid == (failure != null)) {
      throw new IllegalArgumentException("failure must be set exactly when invalid");
    }
  }

  public static SignatureVerification accepted() {
    return VALID;
  }

  public static SignatureVerification invalid(SignatureFailure failure) {
    return new SignatureVerification(false, failure);
  }
}
