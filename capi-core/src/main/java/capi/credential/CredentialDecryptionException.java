package capi.credential;

/**
 * Thrown when an encrypted credential blob cannot be opened with the tenant's key.
 */
public final class CredentialDecryptionException extends RuntimeException {

  public CredentialDecryptionException(String message) {
    super(message);
  }

  public CredentialDecryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
