package capi.privacy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Identity fields accepted for hashing, each with its destination key and normalization rule.
 *
 * <p>Normalization must be deterministic: the destination matches people across events by
 * comparing digests, so the same person must always normalize to the same string.
 */
public enum IdentityField {
  EMAIL("em") {
    @Override
    Optional<String> normalize(String raw) {
      String value = raw.trim().toLowerCase(Locale.ROOT);
      return value.indexOf('@') > 0 ? Optional.of(value) : Optional.empty();
    }
  },
  PHONE("ph") {
    @Override
    Optional<String> normalize(String raw) {
      String digits = digitsOnly(raw);
      if (digits.length() < 10) {
        return Optional.empty();
      }
      if (digits.length() == 10) {
        // bare national number, assume North American country code
        digits = "1" + digits;
      } else if (digits.startsWith("00")) {
        digits = digits.substring(2);
      }
      return Optional.of(digits);
    }
  },
  FIRST_NAME("fn") {
    @Override
    Optional<String> normalize(String raw) {
      return nonEmpty(lettersOnly(raw));
    }
  },
  LAST_NAME("ln") {
    @Override
    Optional<String> normalize(String raw) {
      return nonEmpty(lettersOnly(raw));
    }
  },
  CITY("ct") {
    @Override
    Optional<String> normalize(String raw) {
      return nonEmpty(lettersOnly(raw));
    }
  },
  STATE("st") {
    @Override
    Optional<String> normalize(String raw) {
      String letters = lettersOnly(raw);
      if (letters.length() == 2) {
        return Optional.of(letters);
      }
      // unrecognized names are dropped rather than hashed
      return Optional.ofNullable(US_STATES.get(letters));
    }
  },
  POSTAL_CODE("zp") {
    @Override
    Optional<String> normalize(String raw) {
      String digits = digitsOnly(raw);
      return digits.length() < 5 ? Optional.empty() : Optional.of(digits.substring(0, 5));
    }
  },
  COUNTRY("country") {
    @Override
    Optional<String> normalize(String raw) {
      String value = raw.trim().toLowerCase(Locale.ROOT);
      String mapped = COUNTRY_ALIASES.get(value);
      if (mapped != null) {
        return Optional.of(mapped);
      }
      String letters = lettersOnly(value);
      return letters.length() < 2 ? Optional.empty() : Optional.of(letters.substring(0, 2));
    }
  };

  private static final Map<String, String> COUNTRY_ALIASES = Map.of(
      "united states", "us",
      "usa", "us",
      "u.s.a.", "us",
      "u.s.", "us",
      "america", "us",
      "canada", "ca",
      "united kingdom", "gb",
      "uk", "gb",
      "australia", "au");

  private static final Map<String, String> US_STATES = Map.ofEntries(
      Map.entry("alabama", "al"), Map.entry("alaska", "ak"), Map.entry("arizona", "az"),
      Map.entry("arkansas", "ar"), Map.entry("california", "ca"), Map.entry("colorado", "co"),
      Map.entry("connecticut", "ct"), Map.entry("delaware", "de"), Map.entry("florida", "fl"),
      Map.entry("georgia", "ga"), Map.entry("hawaii", "hi"), Map.entry("idaho", "id"),
      Map.entry("illinois", "il"), Map.entry("indiana", "in"), Map.entry("iowa", "ia"),
      Map.entry("kansas", "ks"), Map.entry("kentucky", "ky"), Map.entry("louisiana", "la"),
      Map.entry("maine", "me"), Map.entry("maryland", "md"), Map.entry("massachusetts", "ma"),
      Map.entry("michigan", "mi"), Map.entry("minnesota", "mn"), Map.entry("mississippi", "ms"),
      Map.entry("missouri", "mo"), Map.entry("montana", "mt"), Map.entry("nebraska", "ne"),
      Map.entry("nevada", "nv"), Map.entry("newhampshire", "nh"), Map.entry("newjersey", "nj"),
      Map.entry("newmexico", "nm"), Map.entry("newyork", "ny"), Map.entry("northcarolina", "nc"),
      Map.entry("northdakota", "nd"), Map.entry("ohio", "oh"), Map.entry("oklahoma", "ok"),
      Map.entry("oregon", "or"), Map.entry("pennsylvania", "pa"), Map.entry("rhodeisland", "ri"),
      Map.entry("southcarolina", "sc"), Map.entry("southdakota", "sd"), Map.entry("tennessee", "tn"),
      Map.entry("texas", "tx"), Map.entry("utah", "ut"), Map.entry("vermont", "vt"),
      Map.entry("virginia", "va"), Map.entry("washington", "wa"), Map.entry("westvirginia", "wv"),
      Map.entry("wisconsin", "wi"), Map.entry("wyoming", "wy"), Map.entry("districtofcolumbia", "dc"),
      Map.entry("puertorico", "pr"), Map.entry("guam", "gu"), Map.entry("virginislands", "vi"),
      Map.entry("americansamoa", "as"), Map.entry("northernmarianaislands", "mp"));

  private final String key;

  IdentityField(String key) {
    this.key = key;
  }

  /**
   * Destination field key, e.g. {@code em}.
   */
  public String key() {
    return key;
  }

  /**
   * Normalizes a raw value. Empty when the value is unusable and must be omitted.
   */
  abstract Optional<String> normalize(String raw);

  public static Optional<IdentityField> fromKey(String key) {
    for (IdentityField field : values()) {
      if (field.key.equals(key)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }

  private static String digitsOnly(String raw) {
    return raw.replaceAll("[^0-9]", "");
  }

  private static String lettersOnly(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}]", "");
  }

  private static Optional<String> nonEmpty(String value) {
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }
}
