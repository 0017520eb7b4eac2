package io.incentedge.webhooks.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Computes and checks HMAC-SHA256 signatures over timestamped webhook payloads.
 *
 * <p>The signed string is {@code "<unixSeconds>.<payload bytes>"} and the header value is
 * {@code t=<unixSeconds>,v1=<hex mac>}. Verification rejects timestamps further than the
 * tolerance from the current time and compares MACs in constant time. There is no nonce;
 * a captured request can be replayed inside the tolerance window.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class WebhookSigner {
  public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(300);

  private static final String ALGORITHM = "HmacSHA256";
  private static final String TIMESTAMP_KEY = "t=";
  private static final String SIGNATURE_KEY = "v1=";
  private static final HexFormat HEX = HexFormat.of();

  private final Clock clock;
  private final Duration tolerance;

  public WebhookSigner() {
    this(Clock.systemUTC(), DEFAULT_TOLERANCE);
  }

  public WebhookSigner(Clock clock, Duration tolerance) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    if (tolerance.isNegative()) {
      throw new IllegalArgumentException("tolerance must be >= 0, got: " + tolerance);
    }
  }

  /**
   * Signs a payload with the current time.
   *
   * @param payload the exact bytes that will be sent
   * @param secret  the subscription's shared secret
   * @return the signature header value
   */
  public String sign(byte[] payload, String secret) {
    return sign(payload, secret, clock.instant().getEpochSecond());
  }

  /**
   * Signs a payload with an explicit timestamp.
   *
   * @param payload   the exact bytes that will be sent
   * @param secret    the subscription's shared secret
   * @param timestamp Unix seconds to embed
   * @return the signature header value
   */
  public String sign(byte[] payload, String secret, long timestamp) {
    Objects.requireNonNull(payload, "payload");
    byte[] mac = computeMac(payload, secret, timestamp);
    return TIMESTAMP_KEY + timestamp + "," + SIGNATURE_KEY + HEX.formatHex(mac);
  }

  /**
   * Verifies a signature header against a payload using the configured tolerance.
   *
   * @param payload         the raw bytes received, not a re-serialization
   * @param signatureHeader the received signature header
   * @param secret          the shared secret
   * @return the verification outcome
   */
  public SignatureVerification verify(byte[] payload, String signatureHeader, String secret) {
    return verify(payload, signatureHeader, secret, tolerance);
  }

  /**
   * Verifies a signature header against a payload.
   *
   * @param payload         the raw bytes received
   * @param signatureHeader the received signature header
   * @param secret          the shared secret
   * @param tolerance       maximum allowed distance between the signed timestamp and now
   * @return the verification outcome
   */
  public SignatureVerification verify(byte[] payload, String signatureHeader, String secret,
      Duration tolerance) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(tolerance, "tolerance");
    if (signatureHeader == null) {
      return SignatureVerification.invalid(SignatureFailure.MALFORMED_SIGNATURE);
    }
    String timestampPart = null;
    String signaturePart = null;
    for (String part : signatureHeader.split(",")) {
      String trimmed = part.trim();
      if (timestampPart == null && trimmed.startsWith(TIMESTAMP_KEY)) {
        timestampPart = trimmed.substring(TIMESTAMP_KEY.length());
      } else if (signaturePart == null && trimmed.startsWith(SIGNATURE_KEY)) {
        signaturePart = trimmed.substring(SIGNATURE_KEY.length());
      }
    }
    if (timestampPart == null || signaturePart == null) {
      return SignatureVerification.invalid(SignatureFailure.MALFORMED_SIGNATURE);
    }

    long timestamp;
    byte[] received;
    try {
      timestamp = Long.parseLong(timestampPart);
      received = HEX.parseHex(signaturePart);
    } catch (IllegalArgumentException e) {
      return SignatureVerification.invalid(SignatureFailure.MALFORMED_SIGNATURE);
    }

    long now = clock.instant().getEpochSecond();
    if (Math.abs(now - timestamp) > tolerance.toSeconds()) {
      return SignatureVerification.invalid(SignatureFailure.STALE_SIGNATURE);
    }

    byte[] expected = computeMac(payload, secret, timestamp);
    if (received.length != expected.length || !MessageDigest.isEqual(received, expected)) {
      return SignatureVerification.invalid(SignatureFailure.SIGNATURE_MISMATCH);
    }
    return SignatureVerification.accepted();
  }

  /**
   * Verifies a signature and throws if it is rejected.
   *
   * @throws WebhookSignatureException if verification fails
   */
  public void verifyOrThrow(byte[] payload, String signatureHeader, String secret) {
    SignatureVerification result = verify(payload, signatureHeader, secret);
    if (!result.valid()) {
      throw new WebhookSignatureException(result.failure());
    }
  }

  private static byte[] computeMac(byte[] payload, String secret, long timestamp) {
    Objects.requireNonNull(secret, "secret");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      mac.update((timestamp + ".").getBytes(StandardCharsets.US_ASCII));
      return mac.doFinal(payload);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(ALGORITHM + " unavailable", e);
    }
  }
}
