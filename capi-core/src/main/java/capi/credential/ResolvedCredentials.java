package capi.credential;

import capi.model.PrivacyMode;

import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to build and send one tenant's events.
 *
 * @param organizationId tenant id
 * @param destinationId  tenant's default destination id
 * @param accessToken    token for the destination API
 * @param privacyMode    tenant privacy mode
 * @param testEventCode  destination test code (may be {@code null})
 * @param fieldAllowList tenant allow-list override (may be {@code null})
 * @param tokenSource    how the token was obtained
 */
public record ResolvedCredentials(
    String organizationId,
    String destinationId,
    String accessToken,
    PrivacyMode privacyMode,
    String testEventCode,
    Set<String> fieldAllowList,
    TokenSource tokenSource) {

  public ResolvedCredentials {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(tokenSource, "tokenSource");
    privacyMode = privacyMode == null ? PrivacyMode.CONSERVATIVE : privacyMode;
  }

  @Override
  public String toString() {
    return "ResolvedCredentials[organizationId=" + organizationId
        + ", destinationId=" + destinationId
        + ", privacyMode=" + privacyMode
        + ", testEventCode=" + testEventCode
        + ", tokenSource=" + tokenSource + "]";
  }
}
