package capi.credential;

/**
 * Thrown when no usable access token exists for a tenant by any resolution path.
 */
public final class NoCredentialsException extends CredentialResolutionException {

  public NoCredentialsException(String organizationId, String reason, Throwable cause) {
    super(organizationId, "No valid CAPI credentials for organization " + organizationId + ": " + reason, cause);
  }
}
