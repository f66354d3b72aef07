package capi.privacy;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts destination click ids ({@code fbc}) from upstream ref codes.
 *
 * <p>Redirect-tracked ref codes carry the click id behind an {@code fb_} prefix. Internal
 * tracking codes of the payment processor ({@code ab_...}) and anything else are rejected.
 */
public final class ClickIds {
  private static final String REDIRECT_PREFIX = "fb_";
  private static final Pattern OPAQUE_ID = Pattern.compile("[A-Za-z0-9_-]{15,}");

  private ClickIds() {}

  public static boolean isValid(String refCode) {
    if (refCode == null || !refCode.startsWith(REDIRECT_PREFIX)) {
      return false;
    }
    String candidate = refCode.substring(REDIRECT_PREFIX.length());
    if (candidate.startsWith("fb.") || candidate.startsWith("IwY")
        || candidate.startsWith("IwZ") || candidate.startsWith("PAZ")) {
      return true;
    }
    return OPAQUE_ID.matcher(candidate).matches();
  }

  /**
   * Returns the click id carried by {@code refCode}, without the redirect prefix.
   */
  public static Optional<String> extract(String refCode) {
    if (!isValid(refCode)) {
      return Optional.empty();
    }
    return Optional.of(refCode.substring(REDIRECT_PREFIX.length()));
  }
}
