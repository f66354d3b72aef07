package capi.credential;

import capi.model.TenantCapiConfig;
import capi.model.TenantCredential;
import capi.spi.ConnectionProvider;
import capi.spi.CredentialStore;
import capi.spi.TenantConfigStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves a tenant's destination configuration and access token.
 *
 * <p>Token resolution order: a plaintext record, then a decrypted record, then the injected
 * global fallback token. A decryption failure falls through to the fallback; when nothing is
 * left, {@link NoCredentialsException} is thrown. Called once per tenant per processing pass.
 */
public final class CredentialResolver {
  private static final Logger logger = Logger.getLogger(CredentialResolver.class.getName());

  public static final String DEFAULT_PLATFORM = "meta_capi";

  private final ConnectionProvider connectionProvider;
  private final TenantConfigStore configStore;
  private final CredentialStore credentialStore;
  private final CredentialCipher cipher;
  private final String platform;
  private final String fallbackToken;

  private CredentialResolver(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.configStore = Objects.requireNonNull(builder.configStore, "configStore");
    this.credentialStore = Objects.requireNonNull(builder.credentialStore, "credentialStore");
    this.cipher = builder.cipher;
    this.platform = builder.platform != null ? builder.platform : DEFAULT_PLATFORM;
    this.fallbackToken = builder.fallbackToken == null || builder.fallbackToken.isBlank()
        ? null : builder.fallbackToken;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves configuration and credentials for one tenant.
   *
   * @throws TenantNotConfiguredException if the tenant has no enabled configuration
   * @throws NoCredentialsException       if no token is available by any path
   * @throws SQLException                 if the configuration or credential cannot be read
   */
  public ResolvedCredentials resolve(String organizationId)
      throws CredentialResolutionException, SQLException {
    Objects.requireNonNull(organizationId, "organizationId");
    TenantCapiConfig config;
    Optional<TenantCredential> stored;
    try (Connection conn = connectionProvider.getConnection()) {
      config = configStore.find(conn, organizationId)
          .orElseThrow(() -> new TenantNotConfiguredException(organizationId, "no configuration"));
      if (!config.enabled()) {
        throw new TenantNotConfiguredException(organizationId, "delivery disabled");
      }
      if (config.destinationId() == null || config.destinationId().isBlank()) {
        throw new TenantNotConfiguredException(organizationId, "no destination id");
      }
      stored = credentialStore.findActive(conn, organizationId, platform);
    }

    String token = null;
    TokenSource source = null;
    Throwable failure = null;
    if (stored.isPresent()) {
      TenantCredential credential = stored.get();
      if (credential instanceof TenantCredential.Plaintext plaintext) {
        if (!plaintext.accessToken().isBlank()) {
          token = plaintext.accessToken();
          source = TokenSource.TENANT_PLAINTEXT;
        }
      } else if (credential instanceof TenantCredential.Encrypted encrypted) {
        try {
          token = decrypt(encrypted, organizationId);
          source = TokenSource.TENANT_DECRYPTED;
        } catch (CredentialDecryptionException e) {
          failure = e;
          logger.log(Level.WARNING, "Credential decryption failed for organization " + organizationId
              + (fallbackToken != null ? "; using global fallback token" : ""), e);
        }
      }
    }

    if (token == null && fallbackToken != null) {
      token = fallbackToken;
      source = TokenSource.GLOBAL_FALLBACK;
    }
    if (token == null) {
      String reason = failure != null ? "stored credential could not be decrypted"
          : stored.isPresent() ? "stored credential is empty" : "no active credential";
      throw new NoCredentialsException(organizationId, reason, failure);
    }
    return new ResolvedCredentials(organizationId, config.destinationId(), token,
        config.privacyMode(), config.testEventCode(), config.fieldAllowList(), source);
  }

  private String decrypt(TenantCredential.Encrypted encrypted, String organizationId) {
    if (cipher == null) {
      throw new CredentialDecryptionException("No credential master key configured");
    }
    return cipher.decrypt(encrypted.blob(), organizationId);
  }

  /** Builder for {@link CredentialResolver}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TenantConfigStore configStore;
    private CredentialStore credentialStore;
    private CredentialCipher cipher;
    private String platform;
    private String fallbackToken;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder configStore(TenantConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder credentialStore(CredentialStore credentialStore) {
      this.credentialStore = credentialStore;
      return this;
    }

    /**
     * Sets the cipher for encrypted records.
     *
     * <p>Optional. Without one, encrypted records count as undecryptable.
     */
    public Builder cipher(CredentialCipher cipher) {
      this.cipher = cipher;
      return this;
    }

    /**
     * Sets the credential platform key.
     *
     * <p>Optional. Defaults to {@code meta_capi}.
     */
    public Builder platform(String platform) {
      this.platform = platform;
      return this;
    }

    /**
     * Sets the token used when a tenant has no usable credential of its own.
     *
     * <p>Optional. Blank values are ignored.
     */
    public Builder fallbackToken(String fallbackToken) {
      this.fallbackToken = fallbackToken;
      return this;
    }

    public CredentialResolver build() {
      return new CredentialResolver(this);
    }
  }
}
