package capi.model;

import java.util.Objects;

/**
 * Stored destination credential for a tenant, in one of two storage formats.
 */
public sealed interface TenantCredential {

  /** Token stored as-is. */
  record Plaintext(String accessToken) implements TenantCredential {
    public Plaintext {
      Objects.requireNonNull(accessToken, "accessToken");
    }

    @Override
    public String toString() {
      return "Plaintext[accessToken=***]";
    }
  }

  /** Token sealed with a tenant-derived key; see {@code capi.credential.CredentialCipher}. */
  record Encrypted(String blob) implements TenantCredential {
    public Encrypted {
      Objects.requireNonNull(blob, "blob");
    }
  }
}
