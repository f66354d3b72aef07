package capi.delivery;

import capi.util.JsonCodec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies raw destination responses into {@link DeliveryResult}s.
 *
 * <p>Shared by HTTP client implementations so every transport maps answers the same way.
 */
public final class DeliveryResponses {
  private static final int MAX_BODY_LENGTH = 1000;

  private final JsonCodec jsonCodec;

  public DeliveryResponses(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Classifies an HTTP answer.
   *
   * @param status HTTP status code
   * @param body   response body (may be {@code null})
   */
  public DeliveryResult classify(int status, String body) {
    Map<String, Object> json = parseQuietly(body);
    if (status >= 200 && status < 300) {
      if (json == null) {
        return new DeliveryResult.TransportError(status, "Unparseable success body: " + truncate(body), truncate(body));
      }
      long received = count(json.get("events_received"));
      if (received < 1) {
        return new DeliveryResult.Rejected(status, "events_received=" + received, truncate(body));
      }
      Object trace = json.get("fbtrace_id");
      return new DeliveryResult.Sent((int) Math.min(received, Integer.MAX_VALUE),
          trace == null ? null : trace.toString(),
          jsonCodec.toJson(responseMetadata(received, trace)));
    }
    if (json != null && json.get("error") instanceof Map<?, ?> error) {
      Object message = error.get("message");
      return new DeliveryResult.Rejected(status,
          message == null ? truncate(body) : message.toString(), truncate(body));
    }
    return new DeliveryResult.TransportError(status, truncate(body), truncate(body));
  }

  private static Map<String, Object> responseMetadata(long received, Object trace) {
    return trace == null
        ? Map.of("events_received", received)
        : Map.of("events_received", received, "fbtrace_id", trace);
  }

  private Map<String, Object> parseQuietly(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return jsonCodec.parseObject(body);
    } catch (IllegalArgumentException e) {
      // not JSON; the caller classifies by status alone
      return null;
    }
  }

  /** Reads a count, saturating at the {@code long} range; anything unreadable counts as 0. */
  private static long count(Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    BigInteger exact;
    try {
      exact = new BigDecimal(value.toString().trim()).toBigInteger();
    } catch (NumberFormatException e) {
      return 0;
    }
    if (exact.bitLength() < Long.SIZE) {
      return exact.longValue();
    }
    return exact.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
  }

  static String truncate(String body) {
    if (body == null || body.length() <= MAX_BODY_LENGTH) {
      return body;
    }
    return body.substring(0, MAX_BODY_LENGTH - 3) + "...";
  }
}
