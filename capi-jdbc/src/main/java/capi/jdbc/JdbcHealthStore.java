package capi.jdbc;

import capi.model.HealthStats;
import capi.spi.HealthStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link HealthStore}. Counters are updated in place with relative SQL so
 * concurrent passes for the same tenant never lose an increment.
 */
public final class JdbcHealthStore implements HealthStore {
  private static final int MAX_ERROR_LENGTH = 1000;

  private final String tableName;

  public JdbcHealthStore() {
    this(TableNames.HEALTH_TABLE);
  }

  public JdbcHealthStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void record(Connection conn, String organizationId, boolean success, String error, Instant at) {
    if (applyUpdate(conn, organizationId, success, error, at) > 0) {
      return;
    }
    try {
      JdbcTemplate.update(conn, "INSERT INTO " + tableName
              + " (organization_id, success_count, failure_count, consecutive_failures,"
              + " last_error, last_success_at, last_failure_at) VALUES (?,?,?,?,?,?,?)",
          organizationId, success ? 1 : 0, success ? 0 : 1, success ? 0 : 1,
          success ? null : truncate(error),
          success ? JdbcTemplate.timestamp(at) : null,
          success ? null : JdbcTemplate.timestamp(at));
    } catch (CapiStoreException e) {
      if (!e.isConstraintViolation()) {
        throw e;
      }
      // another pass created the row first
      applyUpdate(conn, organizationId, success, error, at);
    }
  }

  private int applyUpdate(Connection conn, String organizationId, boolean success, String error, Instant at) {
    if (success) {
      return JdbcTemplate.update(conn, "UPDATE " + tableName
              + " SET success_count=success_count+1, consecutive_failures=0, last_success_at=?"
              + " WHERE organization_id=?",
          JdbcTemplate.timestamp(at), organizationId);
    }
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET failure_count=failure_count+1, consecutive_failures=consecutive_failures+1,"
            + " last_error=?, last_failure_at=? WHERE organization_id=?",
        truncate(error), JdbcTemplate.timestamp(at), organizationId);
  }

  @Override
  public Optional<HealthStats> find(Connection conn, String organizationId) {
    return JdbcTemplate.queryOne(conn, selectSql() + " WHERE organization_id=?",
        JdbcHealthStore::mapRow, organizationId);
  }

  @Override
  public List<HealthStats> findAll(Connection conn) {
    return JdbcTemplate.query(conn, selectSql() + " ORDER BY organization_id", JdbcHealthStore::mapRow);
  }

  private String selectSql() {
    return "SELECT organization_id, success_count, failure_count, consecutive_failures, last_error,"
        + " last_success_at, last_failure_at FROM " + tableName;
  }

  private static HealthStats mapRow(ResultSet rs) throws SQLException {
    return new HealthStats(
        rs.getString("organization_id"),
        rs.getLong("success_count"),
        rs.getLong("failure_count"),
        rs.getInt("consecutive_failures"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "last_success_at"),
        JdbcTemplate.instant(rs, "last_failure_at"));
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
