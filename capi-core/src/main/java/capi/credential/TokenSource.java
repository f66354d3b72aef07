package capi.credential;

/**
 * Which resolution path produced an access token.
 */
public enum TokenSource {
  TENANT_PLAINTEXT,
  TENANT_DECRYPTED,
  GLOBAL_FALLBACK
}
