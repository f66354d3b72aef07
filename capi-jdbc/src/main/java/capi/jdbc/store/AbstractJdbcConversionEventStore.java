package capi.jdbc.store;

import capi.jdbc.CapiStoreException;
import capi.jdbc.JdbcTemplate;
import capi.jdbc.TableNames;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import capi.spi.ConversionEventStore;
import capi.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC conversion event store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim strategies.
 * Register custom implementations via
 * {@code META-INF/services/capi.jdbc.store.AbstractJdbcConversionEventStore}.
 *
 * <p>JSON columns ({@code user_data_hashed}, {@code custom_data}) are encoded with the
 * configured {@link JsonCodec}. A claimed row that cannot be read back is marked FAILED with
 * the read error and left out of the claim, so it never blocks the rest of the batch.
 *
 * @see JdbcConversionEventStores
 */
public abstract class AbstractJdbcConversionEventStore implements ConversionEventStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcConversionEventStore.class.getName());
  private static final int MAX_ERROR_LENGTH = 4000;
  static final String UNREADABLE_PREFIX = "Unreadable stored event: ";

  protected static final String DUE_STATUS_IN = "(" + EventStatus.PENDING.code() + ","
      + EventStatus.RETRYING.code() + "," + EventStatus.FAILED.code() + ")";

  protected static final String COLUMNS = "id, organization_id, event_id, dedupe_key, source_id, "
      + "event_name, event_time, event_source_url, user_data_hashed, custom_data, fbp, fbc, "
      + "external_id, client_ip_address, client_user_agent, destination_id, enrichment_only, "
      + "status, retry_count, next_retry_at, last_error, delivered_at, destination_response, created_at";

  private final String tableName;
  private final JsonCodec jsonCodec;
  protected final JdbcTemplate.RowMapper<ConversionEvent> rowMapper;
  protected final JdbcTemplate.RowMapper<ClaimedRow> claimedRowMapper;

  protected AbstractJdbcConversionEventStore() {
    this(TableNames.EVENT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcConversionEventStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = this::mapRow;
    this.claimedRowMapper = this::mapClaimedRow;
  }

  /**
   * A claimed row: either the mapped event, or the reason it could not be mapped.
   */
  protected record ClaimedRow(String id, ConversionEvent event, String error) {
  }

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that uses the given table name and codec.
   */
  public abstract AbstractJdbcConversionEventStore with(String tableName, JsonCodec jsonCodec);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public String upsert(Connection conn, ConversionEvent event) {
    Optional<String> existing = findEventId(conn, event);
    if (existing.isPresent()) {
      refresh(conn, event, existing.get());
      return existing.get();
    }
    try {
      insert(conn, event);
      return event.eventId();
    } catch (CapiStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      // a concurrent writer inserted the same transaction first
      String winner = findEventId(conn, event).orElseThrow(() -> e);
      refresh(conn, event, winner);
      return winner;
    }
  }

  private Optional<String> findEventId(Connection conn, ConversionEvent event) {
    String sql = "SELECT event_id FROM " + tableName()
        + " WHERE organization_id=? AND (event_id=? OR dedupe_key=?)";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getString("event_id"),
        event.organizationId(), event.eventId(), event.dedupeKey());
  }

  private void insert(Connection conn, ConversionEvent event) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", locked_by, locked_at) "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        event.id(), event.organizationId(), event.eventId(), event.dedupeKey(), event.sourceId(),
        event.eventName(), JdbcTemplate.timestamp(event.eventTime()), event.eventSourceUrl(),
        jsonCodec.toJson(event.userDataHashed()), jsonCodec.toJson(event.customData()),
        event.fbp(), event.fbc(), event.externalId(), event.clientIpAddress(), event.clientUserAgent(),
        event.destinationId(), event.enrichmentOnly(), event.status().code(), event.retryCount(),
        JdbcTemplate.timestamp(event.nextRetryAt()), truncateError(event.lastError()),
        JdbcTemplate.timestamp(event.deliveredAt()), event.destinationResponse(),
        JdbcTemplate.timestamp(event.createdAt()));
  }

  private void refresh(Connection conn, ConversionEvent event, String eventId) {
    String sql = "UPDATE " + tableName() + " SET source_id=?, event_name=?, event_time=?, "
        + "event_source_url=?, user_data_hashed=?, custom_data=?, fbp=?, fbc=?, external_id=?, "
        + "client_ip_address=?, client_user_agent=?, destination_id=? "
        + "WHERE organization_id=? AND event_id=?";
    JdbcTemplate.update(conn, sql,
        event.sourceId(), event.eventName(), JdbcTemplate.timestamp(event.eventTime()),
        event.eventSourceUrl(), jsonCodec.toJson(event.userDataHashed()),
        jsonCodec.toJson(event.customData()), event.fbp(), event.fbc(), event.externalId(),
        event.clientIpAddress(), event.clientUserAgent(), event.destinationId(),
        event.organizationId(), eventId);
  }

  @Override
  public Optional<ConversionEvent> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, id);
  }

  @Override
  public List<ConversionEvent> claimDue(Connection conn, String ownerId, Instant now,
      Instant leaseUntil, int maxAttempts, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + tableName()
        + " SET status=" + EventStatus.RETRYING.code() + ", locked_by=?, locked_at=?, next_retry_at=?"
        + " WHERE id IN (SELECT id FROM " + tableName()
        + " WHERE status IN " + DUE_STATUS_IN + " AND retry_count < ?"
        + " AND (next_retry_at IS NULL OR next_retry_at <= ?)"
        + " ORDER BY next_retry_at NULLS FIRST, created_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, JdbcTemplate.timestamp(nowMs), JdbcTemplate.timestamp(leaseUntil),
        maxAttempts, JdbcTemplate.timestamp(now), limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed in this pass
    return selectClaimed(conn, ownerId, nowMs, maxAttempts);
  }

  /**
   * Selects rows claimed by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<ConversionEvent> selectClaimed(Connection conn, String ownerId, Instant lockedAt,
      int maxAttempts) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE locked_by=? AND locked_at=? AND status=" + EventStatus.RETRYING.code()
        + " ORDER BY created_at";
    return readableClaims(conn, ownerId, maxAttempts,
        JdbcTemplate.query(conn, sql, claimedRowMapper, ownerId, JdbcTemplate.timestamp(lockedAt)));
  }

  /**
   * Returns the mapped events of a claim. Rows that could not be mapped are marked FAILED with
   * their read error and a retry count of at least {@code maxAttempts}, so they are not
   * claimed again until requeued.
   */
  protected List<ConversionEvent> readableClaims(Connection conn, String ownerId, int maxAttempts,
      List<ClaimedRow> rows) {
    List<ConversionEvent> events = new ArrayList<>(rows.size());
    for (ClaimedRow row : rows) {
      if (row.event() != null) {
        events.add(row.event());
        continue;
      }
      logger.log(Level.WARNING, "Failing conversion event " + row.id() + ": " + row.error());
      String sql = "UPDATE " + tableName()
          + " SET status=" + EventStatus.FAILED.code() + ", retry_count=GREATEST(retry_count, ?),"
          + " next_retry_at=NULL, last_error=?, locked_by=NULL, locked_at=NULL"
          + " WHERE id=? AND status=" + EventStatus.RETRYING.code() + " AND locked_by=?";
      JdbcTemplate.update(conn, sql, maxAttempts, truncateError(row.error()), row.id(), ownerId);
    }
    return events;
  }

  @Override
  public int markSent(Connection conn, String id, String ownerId, Instant deliveredAt, String response) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + EventStatus.SENT.code() + ", delivered_at=?, next_retry_at=NULL,"
        + " last_error=NULL, destination_response=?, locked_by=NULL, locked_at=NULL"
        + " WHERE id=? AND status=" + EventStatus.RETRYING.code() + " AND locked_by=?";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(deliveredAt), response, id, ownerId);
  }

  @Override
  public int markFailed(Connection conn, String id, String ownerId, EventStatus status, int retryCount,
      Instant nextRetryAt, String error, String response) {
    if (status != EventStatus.PENDING && status != EventStatus.FAILED) {
      throw new IllegalArgumentException("markFailed status must be PENDING or FAILED, got: " + status);
    }
    String sql = "UPDATE " + tableName()
        + " SET status=?, retry_count=?, next_retry_at=?, last_error=?, destination_response=?,"
        + " locked_by=NULL, locked_at=NULL"
        + " WHERE id=? AND status=" + EventStatus.RETRYING.code() + " AND locked_by=?";
    return JdbcTemplate.update(conn, sql, status.code(), retryCount, JdbcTemplate.timestamp(nextRetryAt),
        truncateError(error), response, id, ownerId);
  }

  @Override
  public List<ConversionEvent> queryFailed(Connection conn, String organizationId, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(tableName())
        .append(" WHERE status=").append(EventStatus.FAILED.code());
    List<ClaimedRow> rows;
    if (organizationId != null) {
      sql.append(" AND organization_id=?");
      sql.append(" ORDER BY created_at LIMIT ?");
      rows = JdbcTemplate.query(conn, sql.toString(), claimedRowMapper, organizationId, limit);
    } else {
      sql.append(" ORDER BY created_at LIMIT ?");
      rows = JdbcTemplate.query(conn, sql.toString(), claimedRowMapper, limit);
    }
    List<ConversionEvent> events = new ArrayList<>(rows.size());
    for (ClaimedRow row : rows) {
      if (row.event() != null) {
        events.add(row.event());
      } else {
        logger.log(Level.WARNING, "Skipping unreadable failed event " + row.id() + ": " + row.error());
      }
    }
    return events;
  }

  @Override
  public int countFailed(Connection conn, String organizationId) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE status=" + EventStatus.FAILED.code();
    List<Integer> counts = organizationId == null
        ? JdbcTemplate.query(conn, sql, rs -> rs.getInt(1))
        : JdbcTemplate.query(conn, sql + " AND organization_id=?", rs -> rs.getInt(1), organizationId);
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public int requeue(Connection conn, String id, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + EventStatus.PENDING.code() + ", retry_count=0, next_retry_at=?,"
        + " locked_by=NULL, locked_at=NULL"
        + " WHERE id=? AND status=" + EventStatus.FAILED.code();
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(now), id);
  }

  private ClaimedRow mapClaimedRow(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    try {
      return new ClaimedRow(id, mapRow(rs), null);
    } catch (RuntimeException e) {
      return new ClaimedRow(id, null, UNREADABLE_PREFIX + e.getMessage());
    }
  }

  private ConversionEvent mapRow(ResultSet rs) throws SQLException {
    return new ConversionEvent(
        rs.getString("id"),
        rs.getString("organization_id"),
        rs.getString("event_id"),
        rs.getString("dedupe_key"),
        rs.getString("source_id"),
        rs.getString("event_name"),
        JdbcTemplate.instant(rs, "event_time"),
        rs.getString("event_source_url"),
        jsonCodec.parseStringMap(rs.getString("user_data_hashed")),
        jsonCodec.parseObject(rs.getString("custom_data")),
        rs.getString("fbp"),
        rs.getString("fbc"),
        rs.getString("external_id"),
        rs.getString("client_ip_address"),
        rs.getString("client_user_agent"),
        rs.getString("destination_id"),
        rs.getBoolean("enrichment_only"),
        EventStatus.fromCode(rs.getInt("status")),
        rs.getInt("retry_count"),
        JdbcTemplate.instant(rs, "next_retry_at"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "delivered_at"),
        rs.getString("destination_response"),
        JdbcTemplate.instant(rs, "created_at"));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
