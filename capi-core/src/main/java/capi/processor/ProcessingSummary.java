package capi.processor;

import java.time.Duration;

/**
 * Result of one processing pass.
 *
 * @param processed events claimed in the pass
 * @param sent      events the destination acknowledged
 * @param failed    events that failed, whether retryable or terminal
 * @param tenants   distinct tenants in the pass
 * @param duration  wall-clock duration
 */
public record ProcessingSummary(int processed, int sent, int failed, int tenants, Duration duration) {

  public static ProcessingSummary empty(Duration duration) {
    return new ProcessingSummary(0, 0, 0, 0, duration);
  }
}
