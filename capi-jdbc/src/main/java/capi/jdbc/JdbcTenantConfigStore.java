package capi.jdbc;

import capi.model.PrivacyMode;
import capi.model.TenantCapiConfig;
import capi.spi.TenantConfigStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC {@link TenantConfigStore} over the tenant configuration table.
 *
 * <p>{@code field_allow_list} is stored comma-separated; a null or blank column means the
 * tenant uses its privacy mode's allow-list.
 */
public final class JdbcTenantConfigStore implements TenantConfigStore {
  private final String tableName;

  public JdbcTenantConfigStore() {
    this(TableNames.TENANT_CONFIG_TABLE);
  }

  public JdbcTenantConfigStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Optional<TenantCapiConfig> find(Connection conn, String organizationId) {
    String sql = "SELECT organization_id, destination_id, enabled, privacy_mode, test_event_code, "
        + "field_allow_list FROM " + tableName + " WHERE organization_id=?";
    return JdbcTemplate.queryOne(conn, sql, JdbcTenantConfigStore::mapRow, organizationId);
  }

  /**
   * Inserts or replaces a tenant's configuration. Used by provisioning tools and tests.
   */
  public void save(Connection conn, TenantCapiConfig config) {
    String allowList = config.allowListOverride()
        .map(fields -> String.join(",", fields))
        .orElse(null);
    int updated = JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET destination_id=?, enabled=?, privacy_mode=?, test_event_code=?, field_allow_list=?"
            + " WHERE organization_id=?",
        config.destinationId(), config.enabled(), config.privacyMode().storageName(),
        config.testEventCode(), allowList, config.organizationId());
    if (updated == 0) {
      JdbcTemplate.update(conn, "INSERT INTO " + tableName
              + " (organization_id, destination_id, enabled, privacy_mode, test_event_code, field_allow_list)"
              + " VALUES (?,?,?,?,?,?)",
          config.organizationId(), config.destinationId(), config.enabled(),
          config.privacyMode().storageName(), config.testEventCode(), allowList);
    }
  }

  private static TenantCapiConfig mapRow(ResultSet rs) throws SQLException {
    return new TenantCapiConfig(
        rs.getString("organization_id"),
        rs.getString("destination_id"),
        rs.getBoolean("enabled"),
        PrivacyMode.parse(rs.getString("privacy_mode")),
        rs.getString("test_event_code"),
        parseAllowList(rs.getString("field_allow_list")));
  }

  static Set<String> parseAllowList(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(field -> !field.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
