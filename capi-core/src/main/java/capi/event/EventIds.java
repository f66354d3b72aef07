package capi.event;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derivation of event identifiers.
 *
 * <p>Enrichment events enrich a browser-side event the destination already holds, so their
 * id must be reproducible from the upstream transaction alone. Primary events get a fresh
 * id once, at creation, and keep it for every retry.
 */
public final class EventIds {
  private static final String ENRICHMENT_TAG = "enrichment";

  private EventIds() {}

  /**
   * Deterministic id: SHA-256 hex of {@code enrichment:organizationId:sourceId}.
   */
  public static String enrichment(String organizationId, String sourceId) {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(sourceId, "sourceId");
    String material = ENRICHMENT_TAG + ":" + organizationId + ":" + sourceId;
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * New random, time-ordered id for a primary event.
   */
  public static String primary() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * New internal record id.
   */
  public static String recordId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  public static String dedupeKey(String eventName, String organizationId, String sourceId) {
    return eventName + ":" + organizationId + ":" + sourceId;
  }
}
