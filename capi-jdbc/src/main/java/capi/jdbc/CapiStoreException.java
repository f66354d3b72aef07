package capi.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the JDBC stores.
 */
public final class CapiStoreException extends RuntimeException {
  public CapiStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the underlying error is an integrity constraint violation (SQLSTATE class 23).
   */
  public boolean isConstraintViolation() {
    return getCause() instanceof SQLException sql
        && sql.getSQLState() != null
        && sql.getSQLState().startsWith("23");
  }
}
