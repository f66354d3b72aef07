package capi.model;

import java.util.Locale;

/**
 * Per-tenant privacy mode selecting which identity fields may be sent.
 */
public enum PrivacyMode {
  CONSERVATIVE,
  STANDARD;

  /**
   * Parses a stored mode name. Unknown or missing values fall back to {@link #CONSERVATIVE};
   * the legacy name {@code balanced} maps to {@link #STANDARD}.
   */
  public static PrivacyMode parse(String value) {
    if (value == null) {
      return CONSERVATIVE;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "standard":
      case "balanced":
        return STANDARD;
      default:
        return CONSERVATIVE;
    }
  }

  public String storageName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
