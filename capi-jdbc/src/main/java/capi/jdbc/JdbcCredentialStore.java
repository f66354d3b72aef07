package capi.jdbc;

import capi.model.TenantCredential;
import capi.spi.CredentialStore;
import capi.util.JsonCodec;

import java.sql.Connection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link CredentialStore} over the credential table.
 *
 * <p>A row carries either plaintext JSON ({@code credentials_json}, with an
 * {@code access_token} or {@code accessToken} field) or a sealed blob
 * ({@code encrypted_blob}). The newest active row for the platform wins; a usable
 * plaintext token takes precedence over the blob. Plaintext JSON that does not parse as an
 * object counts as no plaintext token.
 */
public final class JdbcCredentialStore implements CredentialStore {
  private static final Logger logger = Logger.getLogger(JdbcCredentialStore.class.getName());

  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcCredentialStore() {
    this(TableNames.CREDENTIAL_TABLE, JsonCodec.getDefault());
  }

  public JdbcCredentialStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Optional<TenantCredential> findActive(Connection conn, String organizationId, String platform) {
    String sql = "SELECT credentials_json, encrypted_blob FROM " + tableName
        + " WHERE organization_id=? AND platform=? AND is_active=?"
        + " ORDER BY created_at DESC LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql,
            rs -> toCredential(organizationId, rs.getString("credentials_json"), rs.getString("encrypted_blob")),
            organizationId, platform, true)
        .flatMap(credential -> credential);
  }

  private Optional<TenantCredential> toCredential(String organizationId, String credentialsJson,
      String encryptedBlob) {
    String token = accessToken(organizationId, credentialsJson);
    if (token != null) {
      return Optional.of(new TenantCredential.Plaintext(token));
    }
    if (encryptedBlob != null && !encryptedBlob.isBlank()) {
      return Optional.of(new TenantCredential.Encrypted(encryptedBlob));
    }
    return Optional.empty();
  }

  private String accessToken(String organizationId, String credentialsJson) {
    if (credentialsJson == null || credentialsJson.isBlank()) {
      return null;
    }
    Map<String, Object> fields;
    try {
      fields = jsonCodec.parseObject(credentialsJson);
    } catch (IllegalArgumentException e) {
      // parser messages can echo the stored token; never log them
      logger.log(Level.WARNING, "Ignoring unreadable credentials_json for organization " + organizationId);
      return null;
    }
    Object token = fields.get("access_token");
    if (token == null) {
      token = fields.get("accessToken");
    }
    if (token == null || token.toString().isBlank()) {
      return null;
    }
    return token.toString();
  }
}
