package capi.event;

import java.util.Map;

/**
 * A built destination event. Contains no credentials.
 *
 * @param eventId       idempotency token carried in the event
 * @param destinationId destination the event is addressed to
 * @param event         destination event object ({@code event_name}, {@code event_time}, ...)
 * @param userData      the filtered {@code user_data} block, also present inside {@code event}
 */
public record ConversionPayload(
    String eventId,
    String destinationId,
    Map<String, Object> event,
    Map<String, String> userData) {

  public ConversionPayload {
    event = Map.copyOf(event);
    userData = Map.copyOf(userData);
  }
}
