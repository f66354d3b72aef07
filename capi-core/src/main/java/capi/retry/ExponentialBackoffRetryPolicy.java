package capi.retry;

import java.time.Duration;

/**
 * Retry policy using exponential backoff with a ceiling.
 *
 * <p>Delay formula: {@code min(maxDelay, baseDelay * 2^(attempt-1))}. No jitter is applied,
 * so the schedule for a given attempt count is reproducible.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMinutes(5);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(60);

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
  }

  /**
   * @param baseDelay delay after the first failure
   * @param maxDelay  ceiling for any single delay
   */
  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    this(baseDelay.toMillis(), maxDelay.toMillis());
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public Duration computeDelay(int attempts) {
    if (attempts <= 0) {
      return Duration.ZERO;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    return Duration.ofMillis(Math.min(maxDelayMs, expDelay));
  }
}
