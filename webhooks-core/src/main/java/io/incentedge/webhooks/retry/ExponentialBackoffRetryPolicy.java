package io.incentedge.webhooks.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code capped = min(baseDelay * multiplier^attempt, maxDelay)}, then
 * {@code capped + capped * 0.25 * random[0, 1)}. The result always lies in
 * {@code [capped, capped * 1.25]}, so delays never shrink as attempts grow.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 3_600_000L;
  public static final double DEFAULT_MULTIPLIER = 2.0;

  static final double JITTER_FRACTION = 0.25;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double multiplier;

  /** Base 1 s, cap 1 h, multiplier 2. */
  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_MULTIPLIER);
  }

  /**
   * @param baseDelayMs delay after the first failed attempt, before jitter (milliseconds)
   * @param maxDelayMs  cap applied before jitter (milliseconds)
   * @param multiplier  growth factor per attempt, at least 1
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double multiplier) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be a finite value >= 1, got: " + multiplier);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.multiplier = multiplier;
  }

  @Override
  public long computeDelayMs(int attemptCount) {
    long capped = cappedDelayMs(attemptCount);
    double jitter = capped * JITTER_FRACTION * ThreadLocalRandom.current().nextDouble();
    return capped + (long) jitter;
  }

  /** Delay before jitter for the given attempt. */
  long cappedDelayMs(int attemptCount) {
    int attempt = Math.max(0, attemptCount);
    // pow overflows to Infinity, which min() folds into the cap
    double raw = baseDelayMs * Math.pow(multiplier, attempt);
    return (long) Math.min(raw, (double) maxDelayMs);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double multiplier() {
    return multiplier;
  }
}
