package capi.spring;

import capi.ingest.ConversionEventWriter;
import capi.ingest.ConversionRequest;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * Queues conversion events inside the caller's Spring-managed transaction.
 *
 * <p>Connections are obtained through {@link DataSourceUtils}, so the event row commits or
 * rolls back together with the business transaction that produced it.
 */
public final class SpringConversionEventWriter {
  private final DataSource dataSource;
  private final ConversionEventWriter writer;

  public SpringConversionEventWriter(DataSource dataSource, ConversionEventWriter writer) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  /**
   * Queues the event on the transaction-bound connection.
   *
   * @return the stored {@code eventId}
   * @throws IllegalStateException if no Spring transaction is active
   */
  public String enqueue(ConversionRequest request) {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    Connection conn = DataSourceUtils.getConnection(dataSource);
    try {
      return writer.enqueue(conn, request);
    } finally {
      DataSourceUtils.releaseConnection(conn, dataSource);
    }
  }
}
