package capi.privacy;

import capi.model.ConversionEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-hashed identifiers supplied alongside hashed identity: browser cookie, click id,
 * advertiser subject id and client network details.
 */
public record CorrelationTokens(
    String fbp,
    String fbc,
    String externalId,
    String clientIpAddress,
    String clientUserAgent) {

  public static final CorrelationTokens NONE = new CorrelationTokens(null, null, null, null, null);

  public static CorrelationTokens of(ConversionEvent event) {
    return new CorrelationTokens(event.fbp(), event.fbc(), event.externalId(),
        event.clientIpAddress(), event.clientUserAgent());
  }

  /**
   * Present tokens keyed by destination field name.
   */
  public Map<String, String> asMap() {
    Map<String, String> map = new LinkedHashMap<>();
    putIfPresent(map, "external_id", externalId);
    putIfPresent(map, "fbp", fbp);
    putIfPresent(map, "fbc", fbc);
    putIfPresent(map, "client_ip_address", clientIpAddress);
    putIfPresent(map, "client_user_agent", clientUserAgent);
    return map;
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null && !value.isBlank()) {
      map.put(key, value);
    }
  }
}
