package capi.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation for the JDBC stores.
 */
public final class TableNames {
  public static final String EVENT_TABLE = "capi_conversion_event";
  public static final String TENANT_CONFIG_TABLE = "capi_tenant_config";
  public static final String CREDENTIAL_TABLE = "capi_credential";
  public static final String HEALTH_TABLE = "capi_health_stats";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
