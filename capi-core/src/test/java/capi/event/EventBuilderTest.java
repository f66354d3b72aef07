package capi.event;

import capi.credential.ResolvedCredentials;
import capi.credential.TokenSource;
import capi.model.ConversionEvent;
import capi.model.PrivacyMode;
import capi.testing.TestEvents;
import capi.testing.TestPolicies;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EventBuilderTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final EventBuilder builder = EventBuilder.builder()
      .privacyPolicy(TestPolicies.defaultPolicy())
      .clock(Clock.fixed(NOW, ZoneOffset.UTC))
      .build();

  private static ResolvedCredentials creds(PrivacyMode mode, Set<String> override) {
    return new ResolvedCredentials("org-1", "pixel-1", "token", mode, null, override, TokenSource.TENANT_PLAINTEXT);
  }

  private static ConversionEvent withCustomData(ConversionEvent e, Map<String, Object> customData) {
    return new ConversionEvent(e.id(), e.organizationId(), e.eventId(), e.dedupeKey(), e.sourceId(), e.eventName(),
        e.eventTime(), e.eventSourceUrl(), e.userDataHashed(), customData, e.fbp(), e.fbc(), e.externalId(),
        e.clientIpAddress(), e.clientUserAgent(), e.destinationId(), e.enrichmentOnly(), e.status(),
        e.retryCount(), e.nextRetryAt(), e.lastError(), e.deliveredAt(), e.destinationResponse(), e.createdAt());
  }

  private static ConversionEvent withBrowserCookie(ConversionEvent e, String fbp) {
    return new ConversionEvent(e.id(), e.organizationId(), e.eventId(), e.dedupeKey(), e.sourceId(), e.eventName(),
        e.eventTime(), e.eventSourceUrl(), e.userDataHashed(), e.customData(), fbp, e.fbc(), e.externalId(),
        e.clientIpAddress(), e.clientUserAgent(), "pixel-override", e.enrichmentOnly(), e.status(),
        e.retryCount(), e.nextRetryAt(), e.lastError(), e.deliveredAt(), e.destinationResponse(), e.createdAt());
  }

  @Test
  void buildsPrimaryEventWithStoredId() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    assertEquals(event.eventId(), payload.eventId());
    assertEquals("pixel-1", payload.destinationId());
    Map<String, Object> body = payload.event();
    assertEquals("Purchase", body.get("event_name"));
    assertEquals(NOW.minusSeconds(60).getEpochSecond(), body.get("event_time"));
    assertEquals(event.eventId(), body.get("event_id"));
    assertEquals(EventBuilder.ACTION_SOURCE_SYSTEM, body.get("action_source"));
    assertEquals("https://donate.example.org/page", body.get("event_source_url"));
  }

  @Test
  void enrichmentIdIsDerivedFromSourceTransaction() {
    ConversionEvent event = TestEvents.enrichment("org-1", "txn-9", NOW.minusSeconds(60));

    ConversionPayload first = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));
    ConversionPayload second = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    assertEquals(EventIds.enrichment("org-1", "txn-9"), first.eventId());
    assertEquals(first.event(), second.event());
  }

  @Test
  void sameClockGivesSamePayloadButAgingCanInvalidate() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minus(Duration.ofDays(6)));

    assertEquals(builder.build(event, creds(PrivacyMode.CONSERVATIVE, null)).event(),
        builder.build(event, creds(PrivacyMode.CONSERVATIVE, null)).event());

    EventBuilder later = EventBuilder.builder()
        .privacyPolicy(TestPolicies.defaultPolicy())
        .clock(Clock.fixed(NOW.plus(Duration.ofDays(2)), ZoneOffset.UTC))
        .build();
    assertThrows(PayloadValidationException.class, () -> later.build(event, creds(PrivacyMode.CONSERVATIVE, null)));
  }

  @Test
  void conservativeModeOmitsNames() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    assertEquals(Set.of("em", "ph", "zp", "country", "external_id"), payload.userData().keySet());
    assertEquals(event.userDataHashed().get("em"), payload.userData().get("em"));
  }

  @Test
  void standardModeIncludesNames() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.STANDARD, null));

    assertTrue(payload.userData().keySet().containsAll(List.of("fn", "ln", "ct", "st")));
  }

  @Test
  void tenantOverrideTakesPrecedenceOverMode() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.STANDARD, Set.of("em")));

    assertEquals(Set.of("em"), payload.userData().keySet());
  }

  @Test
  void browserCookieMakesWebsiteSourceAndEventDestinationWins() {
    ConversionEvent event = withBrowserCookie(TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60)),
        "fb.1.1700000000.123");

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    assertEquals(EventBuilder.ACTION_SOURCE_WEBSITE, payload.event().get("action_source"));
    assertEquals("fb.1.1700000000.123", payload.userData().get("fbp"));
    assertEquals("pixel-override", payload.destinationId());
  }

  @Test
  void rejectsEventsOlderThanSevenDays() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minus(Duration.ofDays(8)));

    assertThrows(PayloadValidationException.class, () -> builder.build(event, creds(PrivacyMode.CONSERVATIVE, null)));
  }

  @Test
  void rejectsEventsTooFarInFuture() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.plus(Duration.ofMinutes(11)));

    assertThrows(PayloadValidationException.class, () -> builder.build(event, creds(PrivacyMode.CONSERVATIVE, null)));
  }

  @Test
  void acceptsSmallClockSkew() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.plus(Duration.ofMinutes(5)));

    assertNotNull(builder.build(event, creds(PrivacyMode.CONSERVATIVE, null)));
  }

  @Test
  void missingOrNegativeValueIsRejected() {
    ConversionEvent base = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    assertThrows(PayloadValidationException.class,
        () -> builder.build(withCustomData(base, Map.of("currency", "USD")), creds(PrivacyMode.CONSERVATIVE, null)));
    assertThrows(PayloadValidationException.class,
        () -> builder.build(withCustomData(base, Map.of("value", "-1")), creds(PrivacyMode.CONSERVATIVE, null)));
    assertThrows(PayloadValidationException.class,
        () -> builder.build(withCustomData(base, Map.of("value", "abc")), creds(PrivacyMode.CONSERVATIVE, null)));
  }

  @Test
  void currencyDefaultsToUsdAndIsUppercased() {
    ConversionEvent base = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload noCurrency =
        builder.build(withCustomData(base, Map.of("value", 10)), creds(PrivacyMode.CONSERVATIVE, null));
    ConversionPayload lower =
        builder.build(withCustomData(base, Map.of("value", "0", "currency", "eur")), creds(PrivacyMode.CONSERVATIVE, null));

    @SuppressWarnings("unchecked")
    Map<String, Object> custom = (Map<String, Object>) noCurrency.event().get("custom_data");
    assertEquals("USD", custom.get("currency"));
    assertEquals(new BigDecimal("10"), custom.get("value"));
    @SuppressWarnings("unchecked")
    Map<String, Object> lowerCustom = (Map<String, Object>) lower.event().get("custom_data");
    assertEquals("EUR", lowerCustom.get("currency"));
  }

  @Test
  void missingDestinationIsRejected() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));
    ResolvedCredentials noDestination =
        new ResolvedCredentials("org-1", null, "token", PrivacyMode.CONSERVATIVE, null, null, TokenSource.GLOBAL_FALLBACK);

    assertThrows(PayloadValidationException.class, () -> builder.build(event, noDestination));
  }

  @Test
  void requestBodyCarriesTokenAndOptionalTestCode() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));
    ConversionPayload payload = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    Map<String, Object> body = EventBuilder.requestBody(payload, "token", "TEST123");
    Map<String, Object> withoutCode = EventBuilder.requestBody(payload, "token", null);

    assertEquals(List.of(payload.event()), body.get("data"));
    assertEquals("token", body.get("access_token"));
    assertEquals("TEST123", body.get("test_event_code"));
    assertFalse(withoutCode.containsKey("test_event_code"));
  }

  @Test
  void payloadHoldsNoCredentials() {
    ConversionEvent event = TestEvents.pending("org-1", "txn-1", NOW.minusSeconds(60));

    ConversionPayload payload = builder.build(event, creds(PrivacyMode.CONSERVATIVE, null));

    assertFalse(payload.event().containsKey("access_token"));
    assertFalse(payload.event().toString().contains("token"));
  }
}
