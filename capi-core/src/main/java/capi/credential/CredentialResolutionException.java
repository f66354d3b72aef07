package capi.credential;

/**
 * Base type for tenants whose destination credentials cannot be resolved.
 * Messages never contain token material.
 */
public abstract class CredentialResolutionException extends Exception {
  private final String organizationId;

  protected CredentialResolutionException(String organizationId, String message, Throwable cause) {
    super(message, cause);
    this.organizationId = organizationId;
  }

  public String organizationId() {
    return organizationId;
  }
}
