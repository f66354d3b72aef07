package capi.jdbc.store;

import capi.jdbc.JdbcTemplate;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import capi.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * PostgreSQL conversion event store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim, so concurrent passes never claim the same row.
 */
public final class PostgresConversionEventStore extends AbstractJdbcConversionEventStore {

  public PostgresConversionEventStore() {
    super();
  }

  public PostgresConversionEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcConversionEventStore with(String tableName, JsonCodec jsonCodec) {
    return new PostgresConversionEventStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<ConversionEvent> claimDue(Connection conn, String ownerId, Instant now,
      Instant leaseUntil, int maxAttempts, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName()
        + " SET status=" + EventStatus.RETRYING.code() + ", locked_by=?, locked_at=?, next_retry_at=?"
        + " WHERE id IN (SELECT id FROM " + tableName()
        + " WHERE status IN " + DUE_STATUS_IN + " AND retry_count < ?"
        + " AND (next_retry_at IS NULL OR next_retry_at <= ?)"
        + " ORDER BY next_retry_at NULLS FIRST, created_at LIMIT ?"
        + " FOR UPDATE SKIP LOCKED"
        + ") RETURNING " + COLUMNS;
    List<ClaimedRow> rows = JdbcTemplate.updateReturning(conn, sql, claimedRowMapper,
        ownerId, JdbcTemplate.timestamp(nowMs), JdbcTemplate.timestamp(leaseUntil),
        maxAttempts, JdbcTemplate.timestamp(now), limit);
    return readableClaims(conn, ownerId, maxAttempts, rows);
  }
}
