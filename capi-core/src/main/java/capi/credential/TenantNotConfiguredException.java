package capi.credential;

/**
 * Thrown when a tenant has no destination configuration or has delivery switched off.
 */
public final class TenantNotConfiguredException extends CredentialResolutionException {

  public TenantNotConfiguredException(String organizationId, String reason) {
    super(organizationId, "CAPI not enabled for organization " + organizationId + ": " + reason, null);
  }
}
