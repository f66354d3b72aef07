package capi.privacy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizes and hashes identity fields with SHA-256 (lowercase hex).
 *
 * <p>Hashing happens once, when an event is written. Stored digests are forwarded
 * as-is and never re-hashed. Instances are stateless and thread-safe.
 */
public final class IdentityHasher {
  public static final String DEFAULT_COUNTRY = "us";

  private final String defaultCountry;

  public IdentityHasher() {
    this(DEFAULT_COUNTRY);
  }

  /**
   * @param defaultCountry country code hashed when no country is supplied
   */
  public IdentityHasher(String defaultCountry) {
    Objects.requireNonNull(defaultCountry, "defaultCountry");
    if (IdentityField.COUNTRY.normalize(defaultCountry).isEmpty()) {
      throw new IllegalArgumentException("Invalid default country: " + defaultCountry);
    }
    this.defaultCountry = defaultCountry;
  }

  /**
   * Normalizes and hashes one value.
   *
   * @return the digest, or empty if the value is missing or fails normalization
   */
  public Optional<String> hash(IdentityField field, String raw) {
    Objects.requireNonNull(field, "field");
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return field.normalize(raw).map(IdentityHasher::sha256Hex);
  }

  /**
   * Hashes every usable field of {@code raw} into the storage map keyed by destination key.
   * A country digest is always present; the default country is used when none is supplied.
   */
  public Map<String, String> hashForStorage(Map<IdentityField, String> raw) {
    Map<String, String> hashed = new LinkedHashMap<>();
    for (IdentityField field : IdentityField.values()) {
      String value = raw.get(field);
      hash(field, value).ifPresent(digest -> hashed.put(field.key(), digest));
    }
    if (!hashed.containsKey(IdentityField.COUNTRY.key())) {
      hash(IdentityField.COUNTRY, defaultCountry)
          .ifPresent(digest -> hashed.put(IdentityField.COUNTRY.key(), digest));
    }
    return hashed;
  }

  static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
