package capi.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-tenant destination configuration. Read-only to this system.
 *
 * @param organizationId tenant id
 * @param destinationId  pixel/dataset id events are posted to
 * @param enabled        whether delivery is switched on for the tenant
 * @param privacyMode    field-selection mode
 * @param testEventCode  destination test code, routes events to the test console (may be {@code null})
 * @param fieldAllowList tenant override of the mode's allow-list (may be {@code null})
 */
public record TenantCapiConfig(
    String organizationId,
    String destinationId,
    boolean enabled,
    PrivacyMode privacyMode,
    String testEventCode,
    Set<String> fieldAllowList) {

  public TenantCapiConfig {
    Objects.requireNonNull(organizationId, "organizationId");
    privacyMode = privacyMode == null ? PrivacyMode.CONSERVATIVE : privacyMode;
    fieldAllowList = fieldAllowList == null ? null : Set.copyOf(fieldAllowList);
  }

  public Optional<Set<String>> allowListOverride() {
    return Optional.ofNullable(fieldAllowList);
  }
}
