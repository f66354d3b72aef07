package capi.failed;

import capi.model.ConversionEvent;
import capi.spi.ConnectionProvider;
import capi.spi.ConversionEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting and re-queuing FAILED conversion events.
 *
 * <p>Re-queuing resets the retry budget and makes the event eligible for the next pass.
 * Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see ConversionEventStore#queryFailed
 * @see ConversionEventStore#requeue
 * @see ConversionEventStore#countFailed
 */
public final class FailedEventManager {
  private static final Logger logger = Logger.getLogger(FailedEventManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ConversionEventStore eventStore;
  private final Clock clock;

  public FailedEventManager(ConnectionProvider connectionProvider, ConversionEventStore eventStore) {
    this(connectionProvider, eventStore, Clock.systemUTC());
  }

  public FailedEventManager(ConnectionProvider connectionProvider, ConversionEventStore eventStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Queries FAILED events.
   *
   * @param organizationId optional tenant filter ({@code null} for all)
   * @param limit          maximum number of events to return
   * @return failed events, oldest first
   */
  public List<ConversionEvent> query(String organizationId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.queryFailed(conn, organizationId, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query failed events", e);
      return List.of();
    }
  }

  /**
   * Re-queues a single FAILED event.
   *
   * @param id internal event id
   * @return {@code true} if the event was re-queued, {@code false} if not found or not FAILED
   */
  public boolean requeue(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.requeue(conn, id, clock.instant()) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to requeue event: " + id, e);
      return false;
    }
  }

  /**
   * Re-queues all FAILED events of a tenant, processing in batches.
   *
   * @param organizationId optional tenant filter ({@code null} for all)
   * @param batchSize      number of events per batch
   * @return total number of events re-queued
   */
  public int requeueAll(String organizationId, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    int total = 0;
    List<ConversionEvent> batch;
    do {
      int requeued = 0;
      try (Connection conn = connectionProvider.getConnection()) {
        batch = eventStore.queryFailed(conn, organizationId, batchSize);
        for (ConversionEvent event : batch) {
          if (eventStore.requeue(conn, event.id(), clock.instant()) > 0) {
            requeued++;
          }
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to requeue failed events batch", e);
        break;
      }
      total += requeued;
    } while (batch.size() >= batchSize);
    return total;
  }

  /**
   * Counts FAILED events.
   *
   * @param organizationId optional tenant filter ({@code null} for all)
   * @return the number of failed events
   */
  public int count(String organizationId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return eventStore.countFailed(conn, organizationId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count failed events", e);
      return 0;
    }
  }
}
