package io.incentedge.webhooks.signature;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates and masks subscription secrets.
 */
public final class WebhookSecrets {
  public static final String PREFIX = "whsec_";

  private static final int SECRET_BYTES = 32;
  private static final int VISIBLE_CHARS = 12;
  private static final SecureRandom RANDOM = new SecureRandom();

  private WebhookSecrets() {}

  /** Returns {@code whsec_} followed by 64 random hex characters. */
  public static String generate() {
    byte[] bytes = new byte[SECRET_BYTES];
    RANDOM.nextBytes(bytes);
    return PREFIX + HexFormat.of().formatHex(bytes);
  }

  /**
   * Masks a secret for display: the first 12 characters followed by {@code ...}.
   * Returns {@code null} for {@code null}.
   */
  public static String mask(String secret) {
    if (secret == null) {
      return null;
    }
    return secret.substring(0, Math.min(VISIBLE_CHARS, secret.length())) + "...";
  }
}
