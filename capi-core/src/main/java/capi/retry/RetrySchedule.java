package capi.retry;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Applies a {@link RetryPolicy} and an attempt budget to failed deliveries.
 */
public final class RetrySchedule {
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final RetryPolicy policy;
  private final int maxAttempts;
  private final Clock clock;

  public RetrySchedule(RetryPolicy policy, int maxAttempts, Clock clock) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Earliest time the next attempt may run after {@code attempts} failures.
   */
  public Instant nextRetryAt(int attempts) {
    return clock.instant().plus(policy.computeDelay(attempts));
  }

  /**
   * Whether {@code attempts} failures exhaust the budget.
   */
  public boolean isTerminal(int attempts) {
    return attempts >= maxAttempts;
  }
}
