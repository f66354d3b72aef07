package capi.event;

import capi.credential.ResolvedCredentials;
import capi.model.ConversionEvent;
import capi.privacy.CorrelationTokens;
import capi.privacy.PrivacyPolicy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds destination payloads from stored events.
 *
 * <p>Building is deterministic for a given clock: the same event and credentials produce the
 * same payload, including the same {@code event_id}. The {@code event_time} window is checked
 * against the injected {@link java.time.Clock}, so an event can become unbuildable as it ages.
 * Preconditions are checked before anything is sent; failures raise
 * {@link PayloadValidationException}.
 */
public final class EventBuilder {
  public static final Duration DEFAULT_MAX_EVENT_AGE = Duration.ofDays(7);
  public static final Duration DEFAULT_MAX_FUTURE_SKEW = Duration.ofMinutes(10);
  public static final String DEFAULT_CURRENCY = "USD";

  static final String ACTION_SOURCE_WEBSITE = "website";
  static final String ACTION_SOURCE_SYSTEM = "system_generated";

  private final PrivacyPolicy privacyPolicy;
  private final Clock clock;
  private final Duration maxEventAge;
  private final Duration maxFutureSkew;
  private final String defaultCurrency;

  private EventBuilder(Builder builder) {
    this.privacyPolicy = Objects.requireNonNull(builder.privacyPolicy, "privacyPolicy");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.maxEventAge = builder.maxEventAge;
    this.maxFutureSkew = builder.maxFutureSkew;
    this.defaultCurrency = builder.defaultCurrency;
    if (maxEventAge.isNegative() || maxEventAge.isZero()) {
      throw new IllegalArgumentException("maxEventAge must be > 0");
    }
    if (maxFutureSkew.isNegative()) {
      throw new IllegalArgumentException("maxFutureSkew must be >= 0");
    }
    if (defaultCurrency == null || defaultCurrency.length() != 3) {
      throw new IllegalArgumentException("defaultCurrency must be a 3-letter code, got: " + defaultCurrency);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds the destination event for {@code event} under the tenant's settings.
   *
   * @throws PayloadValidationException if the event violates a payload precondition
   */
  public ConversionPayload build(ConversionEvent event, ResolvedCredentials credentials) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(credentials, "credentials");

    String eventId = eventIdFor(event);
    String destinationId = isBlank(event.destinationId()) ? credentials.destinationId() : event.destinationId();
    if (isBlank(destinationId)) {
      throw new PayloadValidationException("No destination id for event " + event.id());
    }
    if (isBlank(event.eventName())) {
      throw new PayloadValidationException("event_name is missing");
    }

    CorrelationTokens tokens = CorrelationTokens.of(event);
    Map<String, String> userData = credentials.fieldAllowList() != null
        ? privacyPolicy.filter(event.userDataHashed(), credentials.fieldAllowList(), tokens)
        : privacyPolicy.filter(event.userDataHashed(), credentials.privacyMode(), tokens);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("event_name", event.eventName());
    payload.put("event_time", eventTime(event.eventTime()));
    payload.put("event_id", eventId);
    payload.put("action_source", event.hasBrowserTokens() ? ACTION_SOURCE_WEBSITE : ACTION_SOURCE_SYSTEM);
    if (!isBlank(event.eventSourceUrl())) {
      payload.put("event_source_url", event.eventSourceUrl());
    }
    payload.put("user_data", userData);
    payload.put("custom_data", customData(event.customData()));
    return new ConversionPayload(eventId, destinationId, payload, userData);
  }

  /**
   * Wraps a built event into the request body sent to the destination.
   */
  public static Map<String, Object> requestBody(ConversionPayload payload, String accessToken, String testEventCode) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", List.of(payload.event()));
    body.put("access_token", accessToken);
    if (!isBlank(testEventCode)) {
      body.put("test_event_code", testEventCode);
    }
    return body;
  }

  private static String eventIdFor(ConversionEvent event) {
    if (event.enrichmentOnly()) {
      if (isBlank(event.sourceId())) {
        throw new PayloadValidationException("Enrichment event " + event.id() + " has no upstream transaction id");
      }
      return EventIds.enrichment(event.organizationId(), event.sourceId());
    }
    if (isBlank(event.eventId())) {
      throw new PayloadValidationException("Event " + event.id() + " has no event_id");
    }
    return event.eventId();
  }

  private long eventTime(Instant eventTime) {
    if (eventTime == null) {
      throw new PayloadValidationException("event_time is missing");
    }
    Instant now = clock.instant();
    if (eventTime.isBefore(now.minus(maxEventAge))) {
      throw new PayloadValidationException("event_time " + eventTime + " is older than " + maxEventAge);
    }
    if (eventTime.isAfter(now.plus(maxFutureSkew))) {
      throw new PayloadValidationException("event_time " + eventTime + " is in the future");
    }
    return eventTime.getEpochSecond();
  }

  private Map<String, Object> customData(Map<String, Object> source) {
    Map<String, Object> data = new LinkedHashMap<>(source);
    BigDecimal value = toDecimal(source.get("value"));
    if (value.signum() < 0) {
      throw new PayloadValidationException("custom_data.value must not be negative: " + value);
    }
    data.put("value", value);
    Object currency = source.get("currency");
    data.put("currency", currency == null || currency.toString().isBlank()
        ? defaultCurrency : currency.toString().trim().toUpperCase(Locale.ROOT));
    return data;
  }

  private static BigDecimal toDecimal(Object value) {
    if (value == null) {
      throw new PayloadValidationException("custom_data.value is missing");
    }
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    try {
      return new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new PayloadValidationException("custom_data.value is not a number: " + value);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /** Builder for {@link EventBuilder}. */
  public static final class Builder {
    private PrivacyPolicy privacyPolicy;
    private Clock clock;
    private Duration maxEventAge = DEFAULT_MAX_EVENT_AGE;
    private Duration maxFutureSkew = DEFAULT_MAX_FUTURE_SKEW;
    private String defaultCurrency = DEFAULT_CURRENCY;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder privacyPolicy(PrivacyPolicy privacyPolicy) {
      this.privacyPolicy = privacyPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how old an event may be and still be accepted by the destination.
     *
     * <p>Optional. Defaults to 7 days.
     */
    public Builder maxEventAge(Duration maxEventAge) {
      this.maxEventAge = Objects.requireNonNull(maxEventAge, "maxEventAge");
      return this;
    }

    /**
     * Sets how far in the future an event time may lie, to absorb clock skew.
     *
     * <p>Optional. Defaults to 10 minutes.
     */
    public Builder maxFutureSkew(Duration maxFutureSkew) {
      this.maxFutureSkew = Objects.requireNonNull(maxFutureSkew, "maxFutureSkew");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code USD}.
     */
    public Builder defaultCurrency(String defaultCurrency) {
      this.defaultCurrency = defaultCurrency;
      return this;
    }

    public EventBuilder build() {
      return new EventBuilder(this);
    }
  }
}
