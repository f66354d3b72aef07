package capi.model;

import java.time.Instant;

/**
 * Rolling delivery counters for one tenant.
 */
public record HealthStats(
    String organizationId,
    long successCount,
    long failureCount,
    int consecutiveFailures,
    String lastError,
    Instant lastSuccessAt,
    Instant lastFailureAt) {

  public static HealthStats empty(String organizationId) {
    return new HealthStats(organizationId, 0, 0, 0, null, null, null);
  }

  /**
   * Fraction of attempts that failed, or 0 when nothing has been recorded.
   */
  public double failureRate() {
    long total = successCount + failureCount;
    return total == 0 ? 0.0 : (double) failureCount / total;
  }

  public boolean isDegraded(int consecutiveFailureThreshold) {
    return consecutiveFailures >= consecutiveFailureThreshold;
  }
}
