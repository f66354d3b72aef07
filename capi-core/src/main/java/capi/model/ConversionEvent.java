package capi.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A stored conversion event awaiting, or having completed, delivery.
 *
 * <p>{@code userDataHashed} holds identity digests keyed by destination field key
 * ({@code em}, {@code ph}, ...). Raw PII never reaches this type. Entries with a {@code null}
 * value are dropped from both maps.
 *
 * @param id                  internal record key
 * @param organizationId      owning tenant
 * @param eventId             idempotency token sent to the destination; fixed for the event's life
 * @param dedupeKey           {@code eventName:organizationId:sourceId}
 * @param sourceId            upstream transaction id
 * @param eventName           destination event name, e.g. {@code Purchase}
 * @param eventTime           when the transaction happened
 * @param eventSourceUrl      page the conversion is attributed to (may be {@code null})
 * @param userDataHashed      hashed identity fields
 * @param customData          value, currency and order/campaign metadata
 * @param fbp                 browser id cookie (may be {@code null})
 * @param fbc                 click id (may be {@code null})
 * @param externalId          advertiser-side subject id (may be {@code null})
 * @param clientIpAddress     client IP (may be {@code null})
 * @param clientUserAgent     client user agent (may be {@code null})
 * @param destinationId       per-event override of the tenant's destination id (may be {@code null})
 * @param enrichmentOnly      whether this event enriches a browser-side event rather than standing alone
 * @param status              current delivery status
 * @param retryCount          failed attempts so far
 * @param nextRetryAt         earliest next attempt, or lease expiry while RETRYING (may be {@code null})
 * @param lastError           error text of the most recent failure (may be {@code null})
 * @param deliveredAt         when the destination acknowledged the event (may be {@code null})
 * @param destinationResponse raw JSON metadata from the last response (may be {@code null})
 * @param createdAt           when the row was first written
 */
public record ConversionEvent(
    String id,
    String organizationId,
    String eventId,
    String dedupeKey,
    String sourceId,
    String eventName,
    Instant eventTime,
    String eventSourceUrl,
    Map<String, String> userDataHashed,
    Map<String, Object> customData,
    String fbp,
    String fbc,
    String externalId,
    String clientIpAddress,
    String clientUserAgent,
    String destinationId,
    boolean enrichmentOnly,
    EventStatus status,
    int retryCount,
    Instant nextRetryAt,
    String lastError,
    Instant deliveredAt,
    String destinationResponse,
    Instant createdAt) {

  public ConversionEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(status, "status");
    userDataHashed = withoutNullValues(userDataHashed);
    customData = withoutNullValues(customData);
  }

  public boolean hasBrowserTokens() {
    return notBlank(fbp) || notBlank(fbc);
  }

  private static <V> Map<String, V> withoutNullValues(Map<String, V> map) {
    if (map == null) {
      return Map.of();
    }
    Map<String, V> copy = new LinkedHashMap<>();
    map.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return Map.copyOf(copy);
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
