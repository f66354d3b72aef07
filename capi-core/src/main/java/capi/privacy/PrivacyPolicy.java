package capi.privacy;

import capi.model.PrivacyMode;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Selects which stored identity fields and correlation tokens may be sent for a privacy mode.
 *
 * <p>Allow-lists are configuration, supplied through {@link #builder()}. Conservative mode
 * must allow strictly fewer fields than standard mode. Blocked fields are never emitted,
 * whatever an allow-list says.
 */
public final class PrivacyPolicy {

  private final Map<PrivacyMode, Set<String>> allowLists;
  private final Set<String> blocked;

  private PrivacyPolicy(Builder builder) {
    Set<String> conservative = builder.allowLists.get(PrivacyMode.CONSERVATIVE);
    Set<String> standard = builder.allowLists.get(PrivacyMode.STANDARD);
    Objects.requireNonNull(conservative, "conservative allow-list");
    Objects.requireNonNull(standard, "standard allow-list");
    if (!standard.containsAll(conservative) || standard.size() == conservative.size()) {
      throw new IllegalArgumentException(
          "Conservative allow-list must be a strict subset of the standard allow-list: "
              + conservative + " vs " + standard);
    }
    EnumMap<PrivacyMode, Set<String>> lists = new EnumMap<>(PrivacyMode.class);
    lists.put(PrivacyMode.CONSERVATIVE, Set.copyOf(conservative));
    lists.put(PrivacyMode.STANDARD, Set.copyOf(standard));
    this.allowLists = lists;
    this.blocked = Set.copyOf(builder.blocked);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The configured allow-list for a mode.
   */
  public Set<String> allowList(PrivacyMode mode) {
    return allowLists.get(mode == null ? PrivacyMode.CONSERVATIVE : mode);
  }

  /**
   * Filters hashed fields and tokens by the mode's allow-list.
   */
  public Map<String, String> filter(Map<String, String> hashed, PrivacyMode mode, CorrelationTokens tokens) {
    return filter(hashed, allowList(mode), tokens);
  }

  /**
   * Filters hashed fields and tokens by an explicit allow-list, such as a tenant override.
   * Values are copied verbatim; nothing is re-hashed.
   */
  public Map<String, String> filter(Map<String, String> hashed, Set<String> allowList, CorrelationTokens tokens) {
    Objects.requireNonNull(allowList, "allowList");
    Map<String, String> userData = new LinkedHashMap<>();
    if (hashed != null) {
      hashed.forEach((key, value) -> putIfAllowed(userData, allowList, key, value));
    }
    CorrelationTokens present = tokens == null ? CorrelationTokens.NONE : tokens;
    present.asMap().forEach((key, value) -> putIfAllowed(userData, allowList, key, value));
    return userData;
  }

  private void putIfAllowed(Map<String, String> out, Set<String> allowList, String key, String value) {
    if (value == null || value.isEmpty() || blocked.contains(key) || !allowList.contains(key)) {
      return;
    }
    out.put(key, value);
  }

  /** Builder for {@link PrivacyPolicy}. */
  public static final class Builder {
    private final Map<PrivacyMode, Set<String>> allowLists = new EnumMap<>(PrivacyMode.class);
    private final Set<String> blocked = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Sets the fields permitted in conservative mode.
     *
     * <p><b>Required.</b>
     */
    public Builder conservative(Collection<String> fields) {
      allowLists.put(PrivacyMode.CONSERVATIVE, new LinkedHashSet<>(fields));
      return this;
    }

    /**
     * Sets the fields permitted in standard mode. Must strictly contain the conservative list.
     *
     * <p><b>Required.</b>
     */
    public Builder standard(Collection<String> fields) {
      allowLists.put(PrivacyMode.STANDARD, new LinkedHashSet<>(fields));
      return this;
    }

    /**
     * Adds fields that are never sent, even when an allow-list names them.
     *
     * <p>Optional.
     */
    public Builder blocked(Collection<String> fields) {
      blocked.addAll(fields);
      return this;
    }

    /**
     * @throws NullPointerException     if either allow-list is missing
     * @throws IllegalArgumentException if conservative is not a strict subset of standard
     */
    public PrivacyPolicy build() {
      return new PrivacyPolicy(this);
    }
  }
}
