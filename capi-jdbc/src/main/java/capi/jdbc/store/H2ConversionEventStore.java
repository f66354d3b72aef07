package capi.jdbc.store;

import capi.util.JsonCodec;

import java.util.List;

/**
 * H2 conversion event store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcConversionEventStore}.
 */
public final class H2ConversionEventStore extends AbstractJdbcConversionEventStore {

  public H2ConversionEventStore() {
    super();
  }

  public H2ConversionEventStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcConversionEventStore with(String tableName, JsonCodec jsonCodec) {
    return new H2ConversionEventStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
