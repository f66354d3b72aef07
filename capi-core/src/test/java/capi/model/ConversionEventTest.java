package capi.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversionEventTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static ConversionEvent event(Map<String, String> userData, Map<String, Object> customData) {
    return new ConversionEvent("rec-1", "org-1", "evt-1", "Purchase:org-1:txn-1", "txn-1", "Purchase",
        NOW, null, userData, customData, null, null, null, null, null, null, false,
        EventStatus.PENDING, 0, null, null, null, null, NOW);
  }

  @Test
  void nullMapValuesAreDropped() {
    Map<String, String> userData = new HashMap<>();
    userData.put("em", "a".repeat(64));
    userData.put("ph", null);
    Map<String, Object> customData = new HashMap<>();
    customData.put("currency", "USD");
    customData.put("campaign_id", null);

    ConversionEvent event = event(userData, customData);

    assertEquals(Map.of("em", "a".repeat(64)), event.userDataHashed());
    assertEquals(Map.of("currency", "USD"), event.customData());
  }

  @Test
  void missingMapsBecomeEmpty() {
    ConversionEvent event = event(null, null);

    assertTrue(event.userDataHashed().isEmpty());
    assertTrue(event.customData().isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> event.customData().put("x", 1));
  }
}
