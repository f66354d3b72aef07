package capi.health;

import capi.model.HealthStats;
import capi.spi.ConnectionProvider;
import capi.spi.HealthStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records per-tenant delivery outcomes for dashboards and alerting.
 *
 * <p>Store failures are logged and never propagate to the caller.
 */
public final class HealthTracker {
  private static final Logger logger = Logger.getLogger(HealthTracker.class.getName());

  public static final int MAX_ERROR_LENGTH = 500;

  private final ConnectionProvider connectionProvider;
  private final HealthStore healthStore;
  private final Clock clock;

  public HealthTracker(ConnectionProvider connectionProvider, HealthStore healthStore) {
    this(connectionProvider, healthStore, Clock.systemUTC());
  }

  public HealthTracker(ConnectionProvider connectionProvider, HealthStore healthStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.healthStore = Objects.requireNonNull(healthStore, "healthStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void recordSuccess(String organizationId) {
    record(organizationId, true, null);
  }

  public void recordFailure(String organizationId, String error) {
    record(organizationId, false, truncate(error));
  }

  /**
   * Current stats for a tenant; empty counters if nothing was recorded or the store is unreachable.
   */
  public HealthStats stats(String organizationId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return healthStore.find(conn, organizationId).orElseGet(() -> HealthStats.empty(organizationId));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to read health stats for organization " + organizationId, e);
      return HealthStats.empty(organizationId);
    }
  }

  public List<HealthStats> allStats() {
    try (Connection conn = connectionProvider.getConnection()) {
      return healthStore.findAll(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to read health stats", e);
      return List.of();
    }
  }

  /**
   * Tenants whose consecutive failures reached {@code consecutiveFailureThreshold}.
   */
  public List<HealthStats> degraded(int consecutiveFailureThreshold) {
    return allStats().stream()
        .filter(stats -> stats.isDegraded(consecutiveFailureThreshold))
        .toList();
  }

  private void record(String organizationId, boolean success, String error) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      healthStore.record(conn, organizationId, success, error, clock.instant());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record health " + (success ? "success" : "failure")
          + " for organization " + organizationId, e);
    }
  }

  static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
